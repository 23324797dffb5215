package com.ryuqq.recordgraph.application.save;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import com.ryuqq.recordgraph.core.codec.RecordCodec;
import com.ryuqq.recordgraph.core.config.PersistenceConfig;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.DescriptorFieldIntrospector;
import com.ryuqq.recordgraph.core.object.TypeRegistry;
import com.ryuqq.recordgraph.core.spi.Store;
import com.ryuqq.recordgraph.testkit.fixture.Fixtures;
import com.ryuqq.recordgraph.testkit.fixture.Person;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * InFlightSaveRegistry 테스트.
 *
 * <p>진행 중인 같은 대상의 저장은 하나의 쓰기로 합쳐지는지 검증합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InFlightSaveRegistryTest {

    @Mock
    private Store store;

    @Test
    void runOnce_진행중인_같은_Identity는_하나의_future_공유() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        Person person = new Person("alice");
        person.assignIdentity(Identity.of("p-1"));
        CompletableFuture<StoredRecord> pending = new CompletableFuture<>();
        AtomicInteger builds = new AtomicInteger();

        // when
        CompletableFuture<StoredRecord> first = registry.runOnce(person, () -> {
            builds.incrementAndGet();
            return pending;
        });
        CompletableFuture<StoredRecord> second = registry.runOnce(person, () -> {
            builds.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        });

        // then
        assertThat(builds.get()).isEqualTo(1);
        assertThat(second).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);

        StoredRecord stored = StoredRecord.builder("Person").identity(Identity.of("p-1")).build();
        pending.complete(stored);
        assertThat(first.join()).isSameAs(stored);
        assertThat(registry.size()).isZero();
    }

    @Test
    void runOnce_완료_후에는_새로_저장() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        Person person = new Person("alice");
        AtomicInteger builds = new AtomicInteger();
        StoredRecord stored = StoredRecord.builder("Person").identity(Identity.of("p-1")).build();

        // when
        registry.runOnce(person, () -> {
            builds.incrementAndGet();
            return CompletableFuture.completedFuture(stored);
        }).join();
        registry.runOnce(person, () -> {
            builds.incrementAndGet();
            return CompletableFuture.completedFuture(stored);
        }).join();

        // then
        assertThat(builds.get()).isEqualTo(2);
    }

    @Test
    void runOnce_Identity_없는_다른_인스턴스는_별도_저장() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        CompletableFuture<StoredRecord> pending = new CompletableFuture<>();

        // when
        CompletableFuture<StoredRecord> first = registry.runOnce(new Person("a"), () -> pending);
        CompletableFuture<StoredRecord> second = registry.runOnce(new Person("a"), () -> pending);

        // then
        assertThat(second).isNotSameAs(first);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void runOnce_빌더가_예외를_던지면_실패_future_및_항목_제거() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();

        // when
        CompletableFuture<StoredRecord> result = registry.runOnce(new Person("a"), () -> {
            throw new IllegalStateException("boom");
        });

        // then
        assertThat(result).isCompletedExceptionally();
        assertThat(registry.size()).isZero();
    }

    @Test
    void runOnce_null_인자는_예외() {
        InFlightSaveRegistry registry = new InFlightSaveRegistry();

        assertThatThrownBy(() -> registry.runOnce(null, CompletableFuture::new))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("object");
        assertThatThrownBy(() -> registry.runOnce(new Person("a"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("save");
    }

    @Test
    void identityAssigned_이후에는_Identity로도_같은_future에_합류() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        Person person = new Person("alice");
        CompletableFuture<StoredRecord> pending = new CompletableFuture<>();
        CompletableFuture<StoredRecord> first = registry.runOnce(person, () -> pending);

        // when
        person.assignIdentity(Identity.of("p-1"));
        registry.identityAssigned(person);
        CompletableFuture<StoredRecord> second = registry.runOnce(person, CompletableFuture::new);

        // then
        assertThat(second).isSameAs(first);
        assertThat(registry.size()).isEqualTo(2);

        pending.complete(StoredRecord.builder("Person").identity(Identity.of("p-1")).build());
        assertThat(registry.size()).isZero();
    }

    @Test
    void identityAssigned_진행중이_아니면_아무것도_하지_않음() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        Person person = new Person("alice");
        person.assignIdentity(Identity.of("p-1"));

        // when
        registry.identityAssigned(person);

        // then
        assertThat(registry.size()).isZero();
    }

    @Test
    void runNested_Identity_없는_진행중_대상에는_합류() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        Person person = new Person("shared");
        CompletableFuture<StoredRecord> pending = new CompletableFuture<>();
        CompletableFuture<StoredRecord> first = registry.runOnce(person, () -> pending);
        AtomicInteger builds = new AtomicInteger();

        // when
        Optional<CompletableFuture<StoredRecord>> nested = registry.runNested(person, () -> {
            builds.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        });

        // then
        assertThat(nested).containsSame(first);
        assertThat(builds.get()).isZero();
    }

    @Test
    void runNested_Identity_있는_진행중_대상은_기다리지_않음() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        Person person = new Person("shared");
        person.assignIdentity(Identity.of("p-1"));
        registry.runOnce(person, CompletableFuture::new);

        // when
        Optional<CompletableFuture<StoredRecord>> nested = registry.runNested(person, CompletableFuture::new);

        // then
        assertThat(nested).isEmpty();
    }

    @Test
    void runNested_진행중이_아니면_직접_저장() {
        // given
        InFlightSaveRegistry registry = new InFlightSaveRegistry();
        StoredRecord stored = StoredRecord.builder("Person").identity(Identity.of("p-1")).build();

        // when
        Optional<CompletableFuture<StoredRecord>> nested =
            registry.runNested(new Person("a"), () -> CompletableFuture.completedFuture(stored));

        // then
        assertThat(nested).isPresent();
        assertThat(nested.get().join()).isSameAs(stored);
        assertThat(registry.size()).isZero();
    }

    @Test
    void save_동시에_같은_객체를_두번_저장하면_Store_쓰기는_한번() {
        // given
        TypeRegistry types = Fixtures.registry();
        SavePipeline pipeline = new SavePipeline(store, new RecordCache(Duration.ofSeconds(30), 100),
            new RecordCodec(types), new DescriptorFieldIntrospector(types), new PersistenceConfig(),
            new InFlightSaveRegistry());
        CompletableFuture<StoredRecord> pending = new CompletableFuture<>();
        when(store.save(any())).thenReturn(pending);
        Person person = new Person("alice");

        // when
        CompletableFuture<Person> first = pipeline.save(person);
        CompletableFuture<Person> second = pipeline.save(person);
        pending.complete(StoredRecord.builder("Person").identity(Identity.of("p-1")).build());

        // then
        assertThat(first.join()).isSameAs(person);
        assertThat(second.join()).isSameAs(person);
        assertThat(person.getIdentity()).contains(Identity.of("p-1"));
        verify(store, times(1)).save(any());
    }
}

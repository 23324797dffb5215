package com.ryuqq.recordgraph.adapter.runner;

import com.ryuqq.recordgraph.application.graph.RecordGraph;
import com.ryuqq.recordgraph.application.load.LoadPage;
import com.ryuqq.recordgraph.core.error.RecordNotFoundException;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.query.QueryPredicate;
import com.ryuqq.recordgraph.testkit.fixture.Person;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * BlockingRecordGraph 유닛 테스트.
 *
 * <p>비동기 결과를 기다리는 동안의 예외 변환을 검증합니다:</p>
 * <ul>
 *   <li>RuntimeException 원인은 그대로 전파</li>
 *   <li>checked 원인, 타임아웃, 취소, 인터럽트는 IllegalStateException</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BlockingRecordGraphTest {

    @Mock
    private RecordGraph graph;

    private BlockingRecordGraph blocking;

    @BeforeEach
    void setUp() {
        blocking = new BlockingRecordGraph(graph, Duration.ofSeconds(1));
    }

    // ============================================================
    // 1. 정상 완료
    // ============================================================

    @Test
    void save_완료된_결과_반환() {
        // given
        Person person = new Person("alice");
        when(graph.save(person)).thenReturn(CompletableFuture.completedFuture(person));

        // when & then
        assertThat(blocking.save(person)).isSameAs(person);
    }

    @Test
    void loadAll_페이지_반환() {
        // given
        QueryPredicate all = QueryPredicate.all();
        LoadPage<Person> page = new LoadPage<>(List.of(new Person("a")), null, Map.of());
        when(graph.loadAll(Person.class, all, List.of(), 10)).thenReturn(CompletableFuture.completedFuture(page));

        // when & then
        assertThat(blocking.loadAll(Person.class, all, List.of(), 10)).isSameAs(page);
    }

    @Test
    void delete_완료까지_대기() {
        // given
        Person person = new Person("alice");
        when(graph.delete(person)).thenReturn(CompletableFuture.completedFuture(null));

        // when
        blocking.delete(person);

        // then
        verify(graph).delete(person);
    }

    // ============================================================
    // 2. 예외 변환
    // ============================================================

    @Test
    void load_RuntimeException_원인은_그대로_전파() {
        // given
        RecordNotFoundException notFound = new RecordNotFoundException(Identity.of("p-1"), "Person");
        when(graph.load(Person.class, Identity.of("p-1"))).thenReturn(CompletableFuture.failedFuture(notFound));

        // when & then
        assertThatThrownBy(() -> blocking.load(Person.class, Identity.of("p-1"))).isSameAs(notFound);
    }

    @Test
    void load_checked_원인은_IllegalStateException으로_감쌈() {
        // given
        IOException io = new IOException("socket closed");
        when(graph.load(Person.class, Identity.of("p-1"))).thenReturn(CompletableFuture.failedFuture(io));

        // when & then
        assertThatThrownBy(() -> blocking.load(Person.class, Identity.of("p-1")))
            .isInstanceOf(IllegalStateException.class)
            .hasCause(io);
    }

    @Test
    void load_타임아웃이면_IllegalStateException() {
        // given
        BlockingRecordGraph impatient = new BlockingRecordGraph(graph, Duration.ofMillis(20));
        when(graph.load(Person.class, Identity.of("p-1"))).thenReturn(new CompletableFuture<>());

        // when & then
        assertThatThrownBy(() -> impatient.load(Person.class, Identity.of("p-1")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("timed out after 20ms");
    }

    @Test
    void load_취소되면_IllegalStateException() {
        // given
        CompletableFuture<Person> cancelled = new CompletableFuture<>();
        cancelled.cancel(true);
        when(graph.load(Person.class, Identity.of("p-1"))).thenReturn(cancelled);

        // when & then
        assertThatThrownBy(() -> blocking.load(Person.class, Identity.of("p-1")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cancelled");
    }

    @Test
    void load_인터럽트되면_플래그_복원_후_IllegalStateException() {
        // given
        when(graph.load(Person.class, Identity.of("p-1"))).thenReturn(new CompletableFuture<>());
        Thread.currentThread().interrupt();

        // when & then
        try {
            assertThatThrownBy(() -> blocking.load(Person.class, Identity.of("p-1")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    // ============================================================
    // 3. 생성자 검증
    // ============================================================

    @Test
    void 생성자_delegate가_null이면_예외() {
        assertThatThrownBy(() -> new BlockingRecordGraph(null, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delegate");
    }

    @Test
    void 생성자_timeout이_0이면_예외() {
        assertThatThrownBy(() -> new BlockingRecordGraph(graph, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout");
    }

    @Test
    void getTimeout_설정값_반환() {
        assertThat(blocking.getTimeout()).isEqualTo(Duration.ofSeconds(1));
    }
}

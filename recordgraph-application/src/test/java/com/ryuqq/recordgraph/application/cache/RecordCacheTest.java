package com.ryuqq.recordgraph.application.cache;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.PrimitiveValue;
import com.ryuqq.recordgraph.core.model.ReferenceList;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.testkit.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RecordCache 유닛 테스트.
 *
 * <p>TTL, 최대 크기, 연쇄 무효화, 닫힌 캐시 동작을 검증합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
class RecordCacheTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private MutableClock clock;
    private RecordCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        cache = new RecordCache(TTL, 100, clock);
    }

    // ============================================================
    // 1. TTL
    // ============================================================

    @Test
    void get_TTL_이내면_hit() {
        // given
        cache.put(record("a"));
        clock.advance(Duration.ofSeconds(29));

        // when & then
        assertThat(cache.get(Identity.of("a"))).isPresent();
    }

    @Test
    void get_TTL_경과시_miss_및_항목_제거() {
        // given
        cache.put(record("a"));
        clock.advance(TTL);

        // when & then
        assertThat(cache.get(Identity.of("a"))).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void put_재삽입시_삽입_시각_갱신() {
        // given
        cache.put(record("a"));
        clock.advance(Duration.ofSeconds(20));
        cache.put(record("a"));
        clock.advance(Duration.ofSeconds(20));

        // when & then
        assertThat(cache.get(Identity.of("a"))).isPresent();
    }

    @Test
    void purgeExpired_만료_항목만_제거() {
        // given
        cache.put(record("old"));
        clock.advance(Duration.ofSeconds(20));
        cache.put(record("new"));
        clock.advance(Duration.ofSeconds(15));

        // when
        int removed = cache.purgeExpired();

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(cache.get(Identity.of("old"))).isEmpty();
        assertThat(cache.get(Identity.of("new"))).isPresent();
    }

    // ============================================================
    // 2. 최대 크기
    // ============================================================

    @Test
    void put_최대_크기_초과시_가장_오래된_항목_제거() {
        // given
        RecordCache small = new RecordCache(TTL, 2, clock);
        small.put(record("a"));
        small.put(record("b"));

        // when
        small.put(record("c"));

        // then
        assertThat(small.size()).isEqualTo(2);
        assertThat(small.get(Identity.of("a"))).isEmpty();
        assertThat(small.get(Identity.of("b"))).isPresent();
        assertThat(small.get(Identity.of("c"))).isPresent();
    }

    @Test
    void putMany_같은_삽입_시각으로_저장() {
        // when
        cache.putMany(List.of(record("a"), record("b")));
        clock.advance(TTL);

        // then
        assertThat(cache.purgeExpired()).isEqualTo(2);
    }

    // ============================================================
    // 3. 연쇄 무효화
    // ============================================================

    @Test
    void invalidateCascade_참조된_항목까지_제거() {
        // given: a -> b -> [c], c -> a (순환), d는 무관
        cache.put(StoredRecord.builder("Node").identity(Identity.of("a"))
            .field("next", ReferenceValue.to(Identity.of("b"))).build());
        cache.put(StoredRecord.builder("Node").identity(Identity.of("b"))
            .field("children", ReferenceList.of(List.of(Identity.of("c")))).build());
        cache.put(StoredRecord.builder("Node").identity(Identity.of("c"))
            .field("next", ReferenceValue.to(Identity.of("a"))).build());
        cache.put(record("d"));

        // when
        int removed = cache.invalidateCascade(Identity.of("a"));

        // then
        assertThat(removed).isEqualTo(3);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get(Identity.of("d"))).isPresent();
    }

    @Test
    void invalidateCascade_캐시에_없는_참조는_건너뜀() {
        // given
        cache.put(StoredRecord.builder("Node").identity(Identity.of("a"))
            .field("next", ReferenceValue.to(Identity.of("missing"))).build());

        // when & then
        assertThat(cache.invalidateCascade(Identity.of("a"))).isEqualTo(1);
    }

    @Test
    void childReferences_캐시된_레코드의_직접_참조() {
        // given
        cache.put(StoredRecord.builder("Node").identity(Identity.of("a"))
            .field("next", ReferenceValue.to(Identity.of("b")))
            .field("children", ReferenceList.of(List.of(Identity.of("c"), Identity.of("d"))))
            .build());

        // when & then
        assertThat(cache.childReferences(Identity.of("a")))
            .containsExactlyInAnyOrder(Identity.of("b"), Identity.of("c"), Identity.of("d"));
        assertThat(cache.childReferences(Identity.of("unknown"))).isEmpty();
    }

    // ============================================================
    // 4. 검증 및 종료
    // ============================================================

    @Test
    void put_Identity_없는_레코드는_예외() {
        StoredRecord unsaved = StoredRecord.builder("Node").field("name", PrimitiveValue.of("x")).build();

        assertThatThrownBy(() -> cache.put(unsaved))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("identity");
    }

    @Test
    void close_이후_put은_예외_get은_miss() {
        // given
        cache.put(record("a"));

        // when
        cache.close();

        // then
        assertThat(cache.isClosed()).isTrue();
        assertThat(cache.get(Identity.of("a"))).isEmpty();
        assertThatThrownBy(() -> cache.put(record("b")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("closed");
    }

    @Test
    void 생성자_TTL이_0이면_예외() {
        assertThatThrownBy(() -> new RecordCache(Duration.ZERO, 10, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ttl");
    }

    @Test
    void 생성자_maxSize가_0이면_예외() {
        assertThatThrownBy(() -> new RecordCache(TTL, 0, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxSize");
    }

    private static StoredRecord record(String identity) {
        return StoredRecord.builder("Node")
            .identity(Identity.of(identity))
            .field("name", PrimitiveValue.of(identity))
            .build();
    }
}

package com.ryuqq.recordgraph.adapter.runner;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.PrimitiveValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.testkit.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CacheSweeper 테스트.
 *
 * <p>만료 항목 정리와 스케줄러 생명주기를 검증합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
class CacheSweeperTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private MutableClock clock;
    private RecordCache cache;
    private CacheSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        cache = new RecordCache(TTL, 100, clock);
        sweeper = new CacheSweeper(cache, new CacheSweeperConfig().withScanIntervalMs(10));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        sweeper.stop();
    }

    // ============================================================
    // 1. scan
    // ============================================================

    @Test
    void scan_만료된_항목만_제거() {
        // given
        cache.put(record("old"));
        clock.advance(Duration.ofSeconds(20));
        cache.put(record("fresh"));
        clock.advance(Duration.ofSeconds(15));

        // when
        int purged = sweeper.scan();

        // then
        assertThat(purged).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void scan_만료_항목이_없으면_0() {
        cache.put(record("fresh"));

        assertThat(sweeper.scan()).isZero();
    }

    @Test
    void scan_닫힌_캐시는_건너뜀() {
        // given
        cache.close();

        // when & then
        assertThat(sweeper.scan()).isZero();
    }

    // ============================================================
    // 2. 생명주기
    // ============================================================

    @Test
    void start_주기적으로_만료_항목_정리() throws InterruptedException {
        // given
        cache.put(record("old"));
        clock.advance(TTL);

        // when
        sweeper.start();

        // then
        long deadline = System.currentTimeMillis() + 2000;
        while (cache.size() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(cache.size()).isZero();
    }

    @Test
    void start_두번_호출하면_예외() {
        // given
        sweeper.start();

        // when & then
        assertThatThrownBy(() -> sweeper.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    @Test
    void stop_이후_다시_시작_가능() throws InterruptedException {
        // given
        sweeper.start();
        assertThat(sweeper.isRunning()).isTrue();

        // when
        sweeper.stop();

        // then
        assertThat(sweeper.isRunning()).isFalse();
        sweeper.start();
        assertThat(sweeper.isRunning()).isTrue();
    }

    @Test
    void stop_시작하지_않았으면_아무것도_하지_않음() throws InterruptedException {
        sweeper.stop();

        assertThat(sweeper.isRunning()).isFalse();
    }

    // ============================================================
    // 3. 생성자 검증
    // ============================================================

    @Test
    void 생성자_cache가_null이면_예외() {
        assertThatThrownBy(() -> new CacheSweeper(null, new CacheSweeperConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cache");
    }

    @Test
    void 생성자_config가_null이면_예외() {
        assertThatThrownBy(() -> new CacheSweeper(cache, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }

    private static StoredRecord record(String identity) {
        return StoredRecord.builder("Person")
            .identity(Identity.of(identity))
            .field("name", PrimitiveValue.of(identity))
            .build();
    }
}

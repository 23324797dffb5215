package com.ryuqq.recordgraph.adapter.runner;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * CacheSweeper 컴포넌트.
 *
 * <p>RecordCache의 만료 항목을 주기적으로 제거합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <pre>
 * 1. start() → 단일 스레드 스케줄러에 scan()을 scanIntervalMs 주기로 등록
 * 2. scan() → purgeExpired() → 제거 수와 남은 항목 수 로깅
 * 3. stop() → 스케줄러 graceful shutdown (최대 5초 대기 후 강제 종료)
 * </pre>
 *
 * <p><strong>예외 처리:</strong> scan() 중 예외는 로그만 남기고 다음 주기를 계속 실행합니다.
 * 닫힌 캐시는 정리할 항목이 없으므로 건너뜁니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final RecordCache cache;
    private final CacheSweeperConfig config;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param cache 정리할 캐시
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CacheSweeper(RecordCache cache, CacheSweeperConfig config) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cache = cache;
        this.config = config;
    }

    /**
     * 만료 항목 한 번 정리.
     *
     * @return 제거된 항목 수
     */
    public int scan() {
        if (cache.isClosed()) {
            log.debug("CacheSweeper scan skipped: cache closed");
            return 0;
        }
        int purged = cache.purgeExpired();
        log.info("CacheSweeper scan completed: {} expired entries purged, {} remaining", purged, cache.size());
        return purged;
    }

    /**
     * 주기적 정리 시작.
     *
     * @throws IllegalStateException 이미 실행 중인 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("CacheSweeper already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "recordgraph-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::safeScan,
            config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("CacheSweeper started: interval {}ms", config.scanIntervalMs());
    }

    /**
     * 주기적 정리 중지.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public synchronized void stop() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
        log.info("CacheSweeper stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void safeScan() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("CacheSweeper scan failed", e);
        }
    }
}

package com.ryuqq.recordgraph.adapter.runner;

/**
 * CacheSweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 만료 항목 정리 주기 (기본 30000ms, 기본 캐시 TTL과 같음)</li>
 * </ul>
 *
 * <p>TTL보다 훨씬 짧은 주기는 잠금 경쟁만 늘립니다. 만료 항목은 조회 시에도 제거되므로
 * 정리 주기는 메모리 회수 속도만 결정합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 * @param scanIntervalMs 정리 주기 (밀리초, 양수여야 함)
 */
public record CacheSweeperConfig(long scanIntervalMs) {

    /**
     * 기본 설정 생성자 (scanIntervalMs=30000ms).
     */
    public CacheSweeperConfig() {
        this(30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException scanIntervalMs가 양수가 아닌 경우
     */
    public CacheSweeperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
    }

    public CacheSweeperConfig withScanIntervalMs(long scanIntervalMs) {
        return new CacheSweeperConfig(scanIntervalMs);
    }
}

package com.ryuqq.recordgraph.core.config;

import java.time.Duration;

/**
 * 영속화 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>identityStrategy: 첫 저장 시 Identity 결정 (기본 Store 생성)</li>
 *   <li>cacheTtl: 캐시 항목 유효 시간 (기본 30초)</li>
 *   <li>cacheMaxSize: 캐시 권장 최대 크기 (기본 1000, 초과 시 만료 항목 → 오래된 항목 순으로 제거)</li>
 *   <li>errorLogging: 실패 로깅 상세도 (기본 SUMMARY)</li>
 *   <li>detachedReferencePolicy: 분리된 참조 처리 (기본 DEFER)</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 * @param identityStrategy Identity 결정 전략
 * @param cacheTtl 캐시 유효 시간 (양수)
 * @param cacheMaxSize 캐시 권장 최대 크기 (1 이상)
 * @param errorLogging 실패 로깅 상세도
 * @param detachedReferencePolicy 분리된 참조 처리 방식
 */
public record PersistenceConfig(
    IdentityStrategy identityStrategy,
    Duration cacheTtl,
    int cacheMaxSize,
    ErrorLogging errorLogging,
    DetachedReferencePolicy detachedReferencePolicy
) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);
    public static final int DEFAULT_CACHE_MAX_SIZE = 1000;

    /**
     * 기본 설정 생성자.
     */
    public PersistenceConfig() {
        this(IdentityStrategy.storeGenerated(), DEFAULT_CACHE_TTL, DEFAULT_CACHE_MAX_SIZE,
            ErrorLogging.SUMMARY, DetachedReferencePolicy.DEFER);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PersistenceConfig {
        if (identityStrategy == null) {
            throw new IllegalArgumentException("identityStrategy cannot be null");
        }
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must be positive (current: " + cacheTtl + ")");
        }
        if (cacheMaxSize <= 0) {
            throw new IllegalArgumentException("cacheMaxSize must be positive (current: " + cacheMaxSize + ")");
        }
        if (errorLogging == null) {
            throw new IllegalArgumentException("errorLogging cannot be null");
        }
        if (detachedReferencePolicy == null) {
            throw new IllegalArgumentException("detachedReferencePolicy cannot be null");
        }
    }

    public PersistenceConfig withIdentityStrategy(IdentityStrategy identityStrategy) {
        return new PersistenceConfig(identityStrategy, cacheTtl, cacheMaxSize,
            errorLogging, detachedReferencePolicy);
    }

    public PersistenceConfig withCacheTtl(Duration cacheTtl) {
        return new PersistenceConfig(identityStrategy, cacheTtl, cacheMaxSize,
            errorLogging, detachedReferencePolicy);
    }

    public PersistenceConfig withCacheMaxSize(int cacheMaxSize) {
        return new PersistenceConfig(identityStrategy, cacheTtl, cacheMaxSize,
            errorLogging, detachedReferencePolicy);
    }

    public PersistenceConfig withErrorLogging(ErrorLogging errorLogging) {
        return new PersistenceConfig(identityStrategy, cacheTtl, cacheMaxSize,
            errorLogging, detachedReferencePolicy);
    }

    public PersistenceConfig withDetachedReferencePolicy(DetachedReferencePolicy detachedReferencePolicy) {
        return new PersistenceConfig(identityStrategy, cacheTtl, cacheMaxSize,
            errorLogging, detachedReferencePolicy);
    }
}

package com.ryuqq.recordgraph.application.cache;

import com.ryuqq.recordgraph.core.model.StoredRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * 캐시 항목 (레코드 + 삽입 시각).
 *
 * @param record 캐시된 레코드
 * @param insertedAt 삽입 시각
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record CacheEntry(StoredRecord record, Instant insertedAt) {

    public CacheEntry {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (insertedAt == null) {
            throw new IllegalArgumentException("insertedAt cannot be null");
        }
    }

    /**
     * 주어진 시각에 아직 유효한지 확인 ({@code now - insertedAt < ttl}).
     */
    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(insertedAt, now).compareTo(ttl) < 0;
    }
}

package com.ryuqq.recordgraph.application.cache;

import com.ryuqq.recordgraph.core.config.PersistenceConfig;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TTL 기반 레코드 캐시.
 *
 * <p>저장/조회 파이프라인이 공유하며, 왕복 호출을 줄이고 재귀 순회의 범위를 제한합니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>get: {@code now - insertedAt < ttl}일 때만 hit (만료 항목은 조회 시 제거)</li>
 *   <li>put: 같은 Identity면 교체하고 삽입 시각 갱신</li>
 *   <li>invalidateCascade: 캐시된 항목의 참조만 따라가며 제거 (Store를 다시 조회하지 않음)</li>
 *   <li>maxSize는 권장값: 초과 시 만료 항목 → 가장 오래된 항목 순으로 제거</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> 단일 {@link ReentrantLock}이 모든 상태를 보호합니다.
 * 항목이 작고 보유 시간이 짧아 항목별 잠금은 두지 않습니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class RecordCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecordCache.class);

    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<Identity, CacheEntry> entries = new LinkedHashMap<>();
    private boolean closed;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param ttl 항목 유효 시간
     * @param maxSize 권장 최대 크기
     */
    public RecordCache(Duration ttl, int maxSize) {
        this(ttl, maxSize, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입, 테스트용).
     *
     * @param ttl 항목 유효 시간 (양수)
     * @param maxSize 권장 최대 크기 (1 이상)
     * @param clock 시계
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public RecordCache(Duration ttl, int maxSize, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * 설정에서 캐시 생성.
     */
    public static RecordCache from(PersistenceConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new RecordCache(config.cacheTtl(), config.cacheMaxSize(), clock);
    }

    /**
     * 캐시 조회.
     *
     * @param identity Identity
     * @return 유효한 레코드 (없거나 만료되었으면 empty)
     */
    public Optional<StoredRecord> get(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        lock.lock();
        try {
            CacheEntry entry = entries.get(identity);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isFresh(clock.instant(), ttl)) {
                entries.remove(identity);
                return Optional.empty();
            }
            return Optional.of(entry.record());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 레코드 저장.
     *
     * @param record Identity가 있는 레코드
     * @throws IllegalArgumentException 레코드에 Identity가 없는 경우
     * @throws IllegalStateException 캐시가 닫힌 경우
     */
    public void put(StoredRecord record) {
        Identity identity = requireIdentity(record);
        lock.lock();
        try {
            ensureOpen();
            insert(identity, record, clock.instant());
            enforceMaxSize();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 여러 레코드를 같은 삽입 시각으로 저장.
     */
    public void putMany(Collection<StoredRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        for (StoredRecord record : records) {
            requireIdentity(record);
        }
        lock.lock();
        try {
            ensureOpen();
            Instant now = clock.instant();
            for (StoredRecord record : records) {
                insert(record.getIdentity().get(), record, now);
            }
            enforceMaxSize();
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        lock.lock();
        try {
            entries.remove(identity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 항목과, 그 항목에서 참조로 도달 가능한 모든 캐시 항목 제거.
     *
     * @param identity 시작 Identity
     * @return 제거된 항목 수
     */
    public int invalidateCascade(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        lock.lock();
        try {
            int removed = 0;
            Set<Identity> seen = new HashSet<>();
            Deque<Identity> pending = new ArrayDeque<>();
            pending.add(identity);
            while (!pending.isEmpty()) {
                Identity current = pending.poll();
                if (!seen.add(current)) {
                    continue;
                }
                CacheEntry entry = entries.remove(current);
                if (entry != null) {
                    removed++;
                    pending.addAll(entry.record().referencedIdentities());
                }
            }
            log.debug("Cascade invalidation from {} removed {} entries", identity.getValue(), removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 캐시된 레코드가 직접 참조하는 Identity 목록.
     *
     * @param identity Identity
     * @return 참조 Identity (캐시에 없으면 빈 목록)
     */
    public List<Identity> childReferences(Identity identity) {
        return get(identity).map(StoredRecord::referencedIdentities).orElse(List.of());
    }

    /**
     * 만료된 항목 일괄 제거.
     *
     * @return 제거된 항목 수
     */
    public int purgeExpired() {
        lock.lock();
        try {
            return removeExpired(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * 캐시를 비우고 닫습니다. 이후 put은 실패합니다.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            entries.clear();
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private void insert(Identity identity, StoredRecord record, Instant now) {
        // 재삽입 시 삽입 순서의 맨 뒤로
        entries.remove(identity);
        entries.put(identity, new CacheEntry(record, now));
    }

    private void enforceMaxSize() {
        if (entries.size() <= maxSize) {
            return;
        }
        removeExpired(clock.instant());
        Iterator<Map.Entry<Identity, CacheEntry>> oldest = entries.entrySet().iterator();
        while (entries.size() > maxSize && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    private int removeExpired(Instant now) {
        int removed = 0;
        Iterator<CacheEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (!iterator.next().isFresh(now, ttl)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("cache is closed");
        }
    }

    private static Identity requireIdentity(StoredRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return record.getIdentity()
                .orElseThrow(() -> new IllegalArgumentException("record must have an identity to be cached"));
    }
}

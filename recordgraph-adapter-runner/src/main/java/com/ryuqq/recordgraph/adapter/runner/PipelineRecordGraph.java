package com.ryuqq.recordgraph.adapter.runner;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import com.ryuqq.recordgraph.application.delete.DeletePipeline;
import com.ryuqq.recordgraph.application.graph.RecordGraph;
import com.ryuqq.recordgraph.application.load.LoadPage;
import com.ryuqq.recordgraph.application.load.LoadPipeline;
import com.ryuqq.recordgraph.application.save.InFlightSaveRegistry;
import com.ryuqq.recordgraph.application.save.SavePipeline;
import com.ryuqq.recordgraph.core.codec.RecordCodec;
import com.ryuqq.recordgraph.core.config.PersistenceConfig;
import com.ryuqq.recordgraph.core.cycle.CycleDetector;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.object.DescriptorFieldIntrospector;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.object.TypeRegistry;
import com.ryuqq.recordgraph.core.query.QueryCursor;
import com.ryuqq.recordgraph.core.query.QueryPredicate;
import com.ryuqq.recordgraph.core.query.SortKey;
import com.ryuqq.recordgraph.core.spi.FieldIntrospector;
import com.ryuqq.recordgraph.core.spi.Store;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 파이프라인 기반 {@link RecordGraph} 구현체.
 *
 * <p>하나의 Store와 TypeRegistry 위에 캐시, 코덱, 순환 검출기, 저장/조회/삭제 파이프라인을
 * 구성합니다. 모든 파이프라인이 같은 {@link RecordCache}를 공유합니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <pre>
 * TypeRegistry ─┬→ RecordCodec ─────────────┐
 *               └→ DescriptorFieldIntrospector → CycleDetector
 * PersistenceConfig → RecordCache (ttl, maxSize, clock)
 * Store + 위 구성요소 → SavePipeline / LoadPipeline / DeletePipeline
 * </pre>
 *
 * <p><strong>수명:</strong> {@link #close()}는 캐시를 닫습니다. 닫힌 뒤의 저장은 실패합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class PipelineRecordGraph implements RecordGraph, AutoCloseable {

    private final RecordCache cache;
    private final SavePipeline savePipeline;
    private final LoadPipeline loadPipeline;
    private final DeletePipeline deletePipeline;

    /**
     * 생성자 (기본 설정).
     */
    public PipelineRecordGraph(Store store, TypeRegistry registry) {
        this(store, registry, new PersistenceConfig());
    }

    public PipelineRecordGraph(Store store, TypeRegistry registry, PersistenceConfig config) {
        this(store, registry, config, Clock.systemUTC());
    }

    /**
     * 생성자 (Clock 지정).
     *
     * @param store 레코드 저장소
     * @param registry 타입 등록부
     * @param config 영속화 설정
     * @param clock 캐시 TTL 판단에 쓰는 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineRecordGraph(Store store, TypeRegistry registry, PersistenceConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        RecordCodec codec = new RecordCodec(registry);
        FieldIntrospector introspector = new DescriptorFieldIntrospector(registry);
        this.cache = RecordCache.from(config, clock);
        this.savePipeline = new SavePipeline(store, cache, codec, introspector, config, new InFlightSaveRegistry());
        this.loadPipeline = new LoadPipeline(store, cache, codec, new CycleDetector(introspector), config);
        this.deletePipeline = new DeletePipeline(store, cache, introspector, config);
    }

    @Override
    public <T extends Persistable> CompletableFuture<T> save(T object) {
        return savePipeline.save(object);
    }

    @Override
    public <T extends Persistable> CompletableFuture<T> insert(T object) {
        return savePipeline.insert(object);
    }

    @Override
    public <T extends Persistable> CompletableFuture<T> update(T object) {
        return savePipeline.update(object);
    }

    @Override
    public <T extends Persistable> CompletableFuture<T> upsert(T object) {
        return savePipeline.upsert(object);
    }

    @Override
    public <T extends Persistable> CompletableFuture<T> load(Class<T> type, Identity identity) {
        return loadPipeline.loadByIdentity(type, identity);
    }

    @Override
    public <T extends Persistable> CompletableFuture<T> refresh(Class<T> type, Identity identity) {
        return loadPipeline.refresh(type, identity);
    }

    @Override
    public <T extends Persistable> CompletableFuture<LoadPage<T>> loadAll(Class<T> type, QueryPredicate predicate,
                                                                           List<SortKey> sortKeys, int limit) {
        return loadPipeline.loadAll(type, predicate, sortKeys, limit, null);
    }

    @Override
    public <T extends Persistable> CompletableFuture<LoadPage<T>> loadNext(Class<T> type, QueryCursor cursor,
                                                                            int limit) {
        return loadPipeline.loadNext(type, cursor, limit);
    }

    @Override
    public <T extends Persistable> CompletableFuture<LoadPage<T>> loadAllExhaustive(Class<T> type,
                                                                                     QueryPredicate predicate,
                                                                                     List<SortKey> sortKeys,
                                                                                     int limit) {
        return loadPipeline.loadAllExhaustive(type, predicate, sortKeys, limit);
    }

    @Override
    public CompletableFuture<Void> delete(Persistable object) {
        return deletePipeline.delete(object);
    }

    @Override
    public CompletableFuture<Void> deleteCascade(Persistable object) {
        return deletePipeline.deleteCascade(object);
    }

    /**
     * 공유 캐시 (CacheSweeper 연결용).
     */
    public RecordCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        cache.close();
    }
}

package com.ryuqq.recordgraph.application.load;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import com.ryuqq.recordgraph.application.support.ErrorReporter;
import com.ryuqq.recordgraph.application.support.Futures;
import com.ryuqq.recordgraph.core.codec.DecodeContext;
import com.ryuqq.recordgraph.core.codec.RecordCodec;
import com.ryuqq.recordgraph.core.config.PersistenceConfig;
import com.ryuqq.recordgraph.core.cycle.CycleDetector;
import com.ryuqq.recordgraph.core.error.CircularReferenceRejectedException;
import com.ryuqq.recordgraph.core.error.MappingException;
import com.ryuqq.recordgraph.core.error.RecordNotFoundException;
import com.ryuqq.recordgraph.core.error.StoreOperationFailedException;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;
import com.ryuqq.recordgraph.core.query.QueryCursor;
import com.ryuqq.recordgraph.core.query.QueryMatch;
import com.ryuqq.recordgraph.core.query.QueryPredicate;
import com.ryuqq.recordgraph.core.query.QueryRequest;
import com.ryuqq.recordgraph.core.query.QueryResult;
import com.ryuqq.recordgraph.core.query.SortKey;
import com.ryuqq.recordgraph.core.spi.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 조회 파이프라인.
 *
 * <p><strong>단건 조회 (loadByIdentity):</strong></p>
 * <pre>
 * 캐시 hit (TTL 이내) → 인라인 → 디코딩
 * 캐시 miss → fetch → 캐시 → 순환 검사 → 인라인 → 디코딩
 *           순환이 있으면 캐시 항목 제거 후 CircularReferenceRejectedException
 *           디코딩 실패 시 캐시 항목 제거 후 MappingException
 * </pre>
 *
 * <p>순환 검사는 방금 가져온 레코드에서 시작해 캐시에 이미 있는 레코드만 따라갑니다. 캐시 hit은
 * 검사하지 않으며, 캐시가 빈 상태에서 조회한 순환 그래프는 인라인 단계에서 순환 마커로 복원됩니다.</p>
 *
 * <p><strong>페이지 조회 (loadAll):</strong> 레코드마다 독립적으로 디코딩하며, 실패한 레코드는
 * Identity별 partial error로 기록하고 나머지는 반환합니다. 페이지 단위 Store 오류는 페이지 전체를
 * 실패시킵니다.</p>
 *
 * <p><strong>전체 조회 (loadAllExhaustive):</strong> cursor가 없어질 때까지 페이지를 이어 가져오며,
 * 같은 Identity의 partial error는 먼저 기록된 것을 유지합니다. 페이지 오류가 나면 그때까지 모은
 * 결과 없이 오류만 전달합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class LoadPipeline {

    private static final Logger log = LoggerFactory.getLogger(LoadPipeline.class);

    private final Store store;
    private final RecordCache cache;
    private final RecordCodec codec;
    private final CycleDetector cycleDetector;
    private final ReferenceInliner inliner;
    private final ErrorReporter errorReporter;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LoadPipeline(Store store, RecordCache cache, RecordCodec codec, CycleDetector cycleDetector,
                        PersistenceConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (cycleDetector == null) {
            throw new IllegalArgumentException("cycleDetector cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.cache = cache;
        this.codec = codec;
        this.cycleDetector = cycleDetector;
        this.inliner = new ReferenceInliner(store, cache, codec);
        this.errorReporter = new ErrorReporter(config.errorLogging());
    }

    /**
     * Identity로 객체 조회 (캐시 우선).
     *
     * @param type 도메인 타입
     * @param identity Identity
     * @return 객체 (없으면 RecordNotFoundException으로 실패)
     */
    public <T extends Persistable> CompletableFuture<T> loadByIdentity(Class<T> type, Identity identity) {
        requireIdentity(identity);
        TypeDescriptor<T> descriptor = codec.getRegistry().descriptorFor(type);
        Optional<StoredRecord> cached = cache.get(identity);
        CompletableFuture<T> result;
        if (cached.isPresent()) {
            log.debug("Cache hit for {} {}", descriptor.getRecordKind(), identity.getValue());
            result = decodeRecord(cached.get(), descriptor, false);
        } else {
            result = fetchAndDecode(identity, descriptor);
        }
        return reported("load", descriptor, result);
    }

    /**
     * 캐시를 건너뛰고 Store에서 다시 조회.
     *
     * <p>대상과 대상이 참조하는 캐시 항목을 함께 제거하므로 참조된 레코드도 다시 가져옵니다.</p>
     */
    public <T extends Persistable> CompletableFuture<T> refresh(Class<T> type, Identity identity) {
        requireIdentity(identity);
        TypeDescriptor<T> descriptor = codec.getRegistry().descriptorFor(type);
        cache.invalidateCascade(identity);
        return reported("refresh", descriptor, fetchAndDecode(identity, descriptor));
    }

    /**
     * 한 페이지 조회.
     *
     * @param type 도메인 타입
     * @param predicate 조건
     * @param sortKeys 정렬 키
     * @param limit 페이지 크기
     * @param cursorOrNull 이어서 조회할 cursor (첫 페이지면 null)
     * @return 페이지
     */
    public <T extends Persistable> CompletableFuture<LoadPage<T>> loadAll(Class<T> type, QueryPredicate predicate,
                                                                           List<SortKey> sortKeys, int limit,
                                                                           QueryCursor cursorOrNull) {
        TypeDescriptor<T> descriptor = codec.getRegistry().descriptorFor(type);
        QueryRequest request = cursorOrNull == null
            ? QueryRequest.first(descriptor.getRecordKind(), predicate, sortKeys, limit)
            : QueryRequest.continuing(descriptor.getRecordKind(), cursorOrNull, limit);
        return reported("query", descriptor, page(request, descriptor));
    }

    /**
     * cursor에서 이어지는 다음 페이지 조회.
     */
    public <T extends Persistable> CompletableFuture<LoadPage<T>> loadNext(Class<T> type, QueryCursor cursor,
                                                                            int limit) {
        if (cursor == null) {
            throw new IllegalArgumentException("cursor cannot be null");
        }
        return loadAll(type, QueryPredicate.all(), List.of(), limit, cursor);
    }

    /**
     * cursor가 없어질 때까지 모든 페이지 조회.
     *
     * @return 모든 객체와 병합된 partial error를 담은 페이지 (cursor 없음)
     */
    public <T extends Persistable> CompletableFuture<LoadPage<T>> loadAllExhaustive(Class<T> type,
                                                                                     QueryPredicate predicate,
                                                                                     List<SortKey> sortKeys,
                                                                                     int limit) {
        TypeDescriptor<T> descriptor = codec.getRegistry().descriptorFor(type);
        QueryRequest first = QueryRequest.first(descriptor.getRecordKind(), predicate, sortKeys, limit);
        CompletableFuture<LoadPage<T>> result =
            drain(first, descriptor, new ArrayList<>(), new LinkedHashMap<>());
        return reported("query", descriptor, result);
    }

    private <T extends Persistable> CompletableFuture<LoadPage<T>> drain(QueryRequest request,
                                                                        TypeDescriptor<T> descriptor,
                                                                        List<T> items,
                                                                        Map<Identity, Throwable> errors) {
        return page(request, descriptor).thenCompose(page -> {
            items.addAll(page.items());
            page.partialErrors().forEach(errors::putIfAbsent);
            if (page.hasMore()) {
                QueryRequest next = QueryRequest.continuing(request.recordKind(), page.cursorOrNull(), request.limit());
                return drain(next, descriptor, items, errors);
            }
            return CompletableFuture.completedFuture(new LoadPage<>(items, null, errors));
        });
    }

    private <T extends Persistable> CompletableFuture<LoadPage<T>> page(QueryRequest request,
                                                                       TypeDescriptor<T> descriptor) {
        String typeName = descriptor.getRecordKind();
        return Futures.attempt(() -> store.query(request))
            .handle((result, error) -> {
                if (error != null) {
                    throw new StoreOperationFailedException("query", typeName, Futures.unwrap(error));
                }
                return result;
            })
            .thenCompose(result -> decodePage(result, descriptor));
    }

    private <T extends Persistable> CompletableFuture<LoadPage<T>> decodePage(QueryResult result,
                                                                             TypeDescriptor<T> descriptor) {
        List<T> items = new ArrayList<>();
        Map<Identity, Throwable> errors = new LinkedHashMap<>();
        CompletableFuture<Void> done = CompletableFuture.completedFuture(null);
        for (QueryMatch match : result.matches()) {
            done = done.thenCompose(ignored -> {
                if (!match.isSuccess()) {
                    errors.putIfAbsent(match.identity(), match.errorOrNull());
                    return CompletableFuture.completedFuture(null);
                }
                cache.put(match.recordOrNull());
                return decodeRecord(match.recordOrNull(), descriptor, true)
                    .<Void>handle((item, error) -> {
                        if (error != null) {
                            errors.putIfAbsent(match.identity(), Futures.unwrap(error));
                        } else {
                            items.add(item);
                        }
                        return null;
                    });
            });
        }
        return done.thenApply(ignored -> {
            if (!errors.isEmpty()) {
                log.debug("Page of {} decoded with {} partial errors", descriptor.getRecordKind(), errors.size());
            }
            return new LoadPage<>(items, result.cursorOrNull(), errors);
        });
    }

    private <T extends Persistable> CompletableFuture<T> fetchAndDecode(Identity identity,
                                                                       TypeDescriptor<T> descriptor) {
        String typeName = descriptor.getRecordKind();
        return Futures.attempt(() -> store.fetch(identity))
            .handle((record, error) -> {
                if (error != null) {
                    Throwable cause = Futures.unwrap(error);
                    if (cause instanceof RecordNotFoundException) {
                        throw new RecordNotFoundException(identity, typeName);
                    }
                    throw new StoreOperationFailedException("fetch", typeName, cause);
                }
                cache.put(record);
                if (cycleDetector.containsCycle(record, cache::get)) {
                    cache.invalidate(identity);
                    throw new CircularReferenceRejectedException(null, typeName);
                }
                return record;
            })
            .thenCompose(record -> decodeRecord(record, descriptor, true));
    }

    /**
     * 인라인 후 디코딩.
     *
     * @param fetched Store에서 방금 가져온 레코드인지 (실패 시 캐시 제거 대상)
     */
    private <T extends Persistable> CompletableFuture<T> decodeRecord(StoredRecord record,
                                                                     TypeDescriptor<T> descriptor,
                                                                     boolean fetched) {
        Identity identity = record.getIdentity().orElse(null);
        return inliner.inline(record).thenApply(values -> {
            try {
                return decode(record, values, descriptor);
            } catch (MappingException e) {
                if (fetched) {
                    invalidate(identity);
                }
                throw e;
            }
        });
    }

    private <T extends Persistable> T decode(StoredRecord record, Map<String, Object> values,
                                             TypeDescriptor<T> descriptor) {
        String typeName = descriptor.getRecordKind();
        if (!typeName.equals(record.getRecordKind())) {
            throw new MappingException(null, typeName, "record kind '" + record.getRecordKind() + "' does not match");
        }
        try {
            return codec.decode(values, descriptor, new DecodeContext());
        } catch (MappingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MappingException(null, typeName, Futures.unwrap(e).getMessage(), e);
        }
    }

    private void invalidate(Identity identity) {
        if (identity != null) {
            cache.invalidate(identity);
        }
    }

    private <R> CompletableFuture<R> reported(String operation, TypeDescriptor<?> descriptor,
                                              CompletableFuture<R> result) {
        result.whenComplete((value, error) -> {
            if (error != null) {
                errorReporter.report(operation, descriptor.getRecordKind(), error);
            }
        });
        return Futures.unwrapped(result);
    }

    private static void requireIdentity(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
    }
}

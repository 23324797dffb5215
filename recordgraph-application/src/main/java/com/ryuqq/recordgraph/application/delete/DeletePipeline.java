package com.ryuqq.recordgraph.application.delete;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import com.ryuqq.recordgraph.application.support.ErrorReporter;
import com.ryuqq.recordgraph.application.support.Futures;
import com.ryuqq.recordgraph.core.config.PersistenceConfig;
import com.ryuqq.recordgraph.core.error.RecordDoesNotExistException;
import com.ryuqq.recordgraph.core.error.RecordNotFoundException;
import com.ryuqq.recordgraph.core.error.StoreOperationFailedException;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.spi.FieldIntrospector;
import com.ryuqq.recordgraph.core.spi.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 삭제 파이프라인.
 *
 * <p><strong>deleteCascade 처리 흐름:</strong></p>
 * <pre>
 * 1. 레코드가 캐시에 있도록 보장 (없으면 fetch, Store에도 없으면 완료)
 * 2. 캐시된 레코드가 직접 참조하는 자식을 순서대로 삭제 (이미 없는 자식은 무시)
 * 3. 레코드 삭제
 * 4. 캐시에서 연쇄 제거
 * </pre>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class DeletePipeline {

    private static final Logger log = LoggerFactory.getLogger(DeletePipeline.class);

    private final Store store;
    private final RecordCache cache;
    private final FieldIntrospector introspector;
    private final ErrorReporter errorReporter;

    public DeletePipeline(Store store, RecordCache cache, FieldIntrospector introspector, PersistenceConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (introspector == null) {
            throw new IllegalArgumentException("introspector cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.cache = cache;
        this.introspector = introspector;
        this.errorReporter = new ErrorReporter(config.errorLogging());
    }

    /**
     * 객체의 레코드 삭제.
     *
     * @param object 삭제할 객체
     * @return 완료 future (Identity가 없으면 RecordDoesNotExistException)
     */
    public CompletableFuture<Void> delete(Persistable object) {
        String typeName = requireTypeName(object);
        Optional<Identity> identity = object.getIdentity();
        if (identity.isEmpty()) {
            return Futures.failed(new RecordDoesNotExistException(typeName));
        }
        CompletableFuture<Void> result = deleteRecord(identity.get(), typeName)
            .thenRun(() -> cache.invalidate(identity.get()));
        return reported("delete", typeName, result);
    }

    /**
     * 객체와 그 객체가 직접 참조하는 레코드를 삭제.
     */
    public CompletableFuture<Void> deleteCascade(Persistable object) {
        String typeName = requireTypeName(object);
        Optional<Identity> identity = object.getIdentity();
        if (identity.isEmpty()) {
            return Futures.failed(new RecordDoesNotExistException(typeName));
        }
        Identity root = identity.get();
        CompletableFuture<Void> result = ensureCached(root, typeName).thenCompose(record -> {
            if (record.isEmpty()) {
                log.debug("Cascade delete of {} {}: record already gone", typeName, root.getValue());
                cache.invalidate(root);
                return CompletableFuture.completedFuture(null);
            }
            List<Identity> children = cache.childReferences(root);
            CompletableFuture<Void> done = CompletableFuture.completedFuture(null);
            for (Identity child : children) {
                done = done.thenCompose(ignored -> deleteChild(child, typeName));
            }
            return done
                .thenCompose(ignored -> deleteRecord(root, typeName))
                .thenRun(() -> {
                    int removed = cache.invalidateCascade(root);
                    log.debug("Cascade delete of {} {}: {} children, {} cache entries evicted",
                        typeName, root.getValue(), children.size(), removed);
                });
        });
        return reported("deleteCascade", typeName, result);
    }

    private CompletableFuture<Optional<StoredRecord>> ensureCached(Identity identity, String typeName) {
        Optional<StoredRecord> cached = cache.get(identity);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached);
        }
        return Futures.attempt(() -> store.fetch(identity)).handle((record, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof RecordNotFoundException) {
                    return Optional.empty();
                }
                throw new StoreOperationFailedException("fetch", typeName, cause);
            }
            cache.put(record);
            return Optional.of(record);
        });
    }

    private CompletableFuture<Void> deleteChild(Identity child, String typeName) {
        return Futures.attempt(() -> store.delete(child)).handle((ignored, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof RecordNotFoundException) {
                    log.debug("Child {} of {} already deleted", child.getValue(), typeName);
                    return null;
                }
                throw new StoreOperationFailedException("delete", typeName, cause);
            }
            return null;
        });
    }

    private CompletableFuture<Void> deleteRecord(Identity identity, String typeName) {
        return Futures.attempt(() -> store.delete(identity)).handle((ignored, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof RecordNotFoundException) {
                    throw new RecordNotFoundException(identity, typeName);
                }
                throw new StoreOperationFailedException("delete", typeName, cause);
            }
            return null;
        });
    }

    private CompletableFuture<Void> reported(String operation, String typeName, CompletableFuture<Void> result) {
        result.whenComplete((ignored, error) -> {
            if (error != null) {
                errorReporter.report(operation, typeName, error);
            }
        });
        return Futures.unwrapped(result);
    }

    private String requireTypeName(Persistable object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        return introspector.recordKindOf(object);
    }
}

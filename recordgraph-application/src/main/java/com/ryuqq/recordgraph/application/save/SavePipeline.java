package com.ryuqq.recordgraph.application.save;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import com.ryuqq.recordgraph.application.support.ErrorReporter;
import com.ryuqq.recordgraph.application.support.Futures;
import com.ryuqq.recordgraph.core.codec.RecordCodec;
import com.ryuqq.recordgraph.core.config.PersistenceConfig;
import com.ryuqq.recordgraph.core.cycle.CycleDetector;
import com.ryuqq.recordgraph.core.error.CircularReferenceRejectedException;
import com.ryuqq.recordgraph.core.error.FieldProcessingFailedException;
import com.ryuqq.recordgraph.core.error.InvalidReferenceException;
import com.ryuqq.recordgraph.core.error.RecordAlreadyExistsException;
import com.ryuqq.recordgraph.core.error.RecordDoesNotExistException;
import com.ryuqq.recordgraph.core.error.RecordNotFoundException;
import com.ryuqq.recordgraph.core.error.ReferenceSavingFailedException;
import com.ryuqq.recordgraph.core.error.StoreOperationFailedException;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.ReferenceList;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.FieldEntry;
import com.ryuqq.recordgraph.core.object.FieldKind;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.spi.FieldIntrospector;
import com.ryuqq.recordgraph.core.spi.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 객체 그래프 저장 파이프라인.
 *
 * <p>참조는 이미 존재하는 Identity만 가리킬 수 있다는 Store 제약을 지키며 객체 그래프를
 * 레코드 단위의 원자적 쓰기로 변환합니다. 순환이 있으면 2단계로 저장합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 대상 Identity 결정 (기존 Identity, 없으면 IdentityStrategy)
 * 2. 필드별 처리 (순차)
 *    - 원시 값/자산: 그대로 복사
 *    - 단일 참조 V:
 *      a. V에 Identity가 있고 캐시에 있음 → Reference(V)
 *      b. 부모에 Identity가 있음 → V를 먼저 저장 후 Reference(V)
 *      c. V에서 부모로 돌아오는 경로가 있음 → PendingReference
 *      d. 그 외 → DetachedReferencePolicy (SKIP / DEFER / SAVE_FIRST)
 *    - 참조 리스트: 원소마다 (b), 지연이 필요한 원소는 field[i] 오류
 * 3. 레코드 저장 → Identity/시스템 속성 반영 → 캐시
 * 4. 지연 참조가 없으면 완료
 * 5. 지연 참조마다 대상 저장 → 필드 패치 → 다시 저장 → 캐시
 * </pre>
 *
 * <p><strong>동시성:</strong> 한 번의 저장 안에서는 Store 호출을 순차로 기다리며 fan-out 하지
 * 않습니다. 최상위 저장과 참조 대상 저장 모두 {@link InFlightSaveRegistry}를 거치므로, 서로 다른 저장이
 * 같은 새 객체를 참조해도 그 객체는 한 번만 생성됩니다. 현재 체인에서 저장 중인 대상은 레지스트리를
 * 거치지 않습니다.</p>
 *
 * <p>취소/타임아웃은 Store future에서 전파되며, 이미 커밋된 레코드는 되돌리지 않습니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class SavePipeline {

    private static final Logger log = LoggerFactory.getLogger(SavePipeline.class);

    private final Store store;
    private final RecordCache cache;
    private final RecordCodec codec;
    private final FieldIntrospector introspector;
    private final CycleDetector cycleDetector;
    private final PersistenceConfig config;
    private final InFlightSaveRegistry registry;
    private final ErrorReporter errorReporter;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SavePipeline(Store store, RecordCache cache, RecordCodec codec, FieldIntrospector introspector,
                        PersistenceConfig config, InFlightSaveRegistry registry) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (introspector == null) {
            throw new IllegalArgumentException("introspector cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.store = store;
        this.cache = cache;
        this.codec = codec;
        this.introspector = introspector;
        this.cycleDetector = new CycleDetector(introspector);
        this.config = config;
        this.registry = registry;
        this.errorReporter = new ErrorReporter(config.errorLogging());
    }

    /**
     * 객체 그래프 저장 (생성 또는 갱신).
     *
     * @param object 저장할 객체
     * @return Identity와 시스템 속성이 반영된 같은 객체
     */
    public <T extends Persistable> CompletableFuture<T> save(T object) {
        return saveWith(object, new SaveChain());
    }

    private <T extends Persistable> CompletableFuture<T> saveWith(T object, SaveChain chain) {
        return top("save", object, () -> registry.runOnce(object, () -> saveObject(object, chain)));
    }

    /**
     * 새 레코드로 저장.
     *
     * @return Identity가 이미 있으면 RecordAlreadyExistsException으로 실패
     */
    public <T extends Persistable> CompletableFuture<T> insert(T object) {
        requireObject(object);
        Optional<Identity> identity = object.getIdentity();
        if (identity.isPresent()) {
            return Futures.failed(new RecordAlreadyExistsException(identity.get(), kindOf(object)));
        }
        return save(object);
    }

    /**
     * 기존 레코드 갱신.
     *
     * @return Identity가 없으면 RecordDoesNotExistException으로 실패
     */
    public <T extends Persistable> CompletableFuture<T> update(T object) {
        requireObject(object);
        if (object.getIdentity().isEmpty()) {
            return Futures.failed(new RecordDoesNotExistException(kindOf(object)));
        }
        return save(object);
    }

    /**
     * 존재 여부를 확인한 뒤 생성 또는 갱신.
     *
     * <p>Identity가 없으면 생성합니다. Identity가 있으면 Store를 조회해, 없으면(RecordNotFound)
     * 그 Identity로 생성하고 있으면 갱신합니다. 그 외 조회 오류는
     * {@code StoreOperationFailedException("upsert-check")}로 실패합니다.</p>
     */
    public <T extends Persistable> CompletableFuture<T> upsert(T object) {
        requireObject(object);
        Optional<Identity> identity = object.getIdentity();
        if (identity.isEmpty()) {
            return save(object);
        }
        String kind = kindOf(object);
        CompletableFuture<SaveChain> upsertCheck = Futures.attempt(() -> store.fetch(identity.get()))
            .handle((existing, error) -> {
                SaveChain chain = new SaveChain();
                if (error == null) {
                    log.debug("Upsert of {} {}: record exists, updating", kind, identity.get().getValue());
                    cache.put(existing);
                    return chain;
                }
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof RecordNotFoundException) {
                    log.debug("Upsert of {} {}: record not found, creating", kind, identity.get().getValue());
                    chain.markUnpersisted(object);
                    return chain;
                }
                throw new StoreOperationFailedException("upsert-check", kind, cause);
            });
        CompletableFuture<T> result = upsertCheck.thenCompose(chain -> saveWith(object, chain));
        result.whenComplete((saved, error) -> {
            if (error != null && Futures.unwrap(error) instanceof StoreOperationFailedException failure
                    && "upsert-check".equals(failure.getOperation())) {
                errorReporter.report("upsert", kind, failure);
            }
        });
        return Futures.unwrapped(result);
    }

    private <T extends Persistable> CompletableFuture<T> top(String operation, T object,
                                                             Supplier<CompletableFuture<StoredRecord>> save) {
        requireObject(object);
        CompletableFuture<T> result = Futures.attempt(save).thenApply(stored -> {
            adopt(object, stored);
            return object;
        });
        result.whenComplete((saved, error) -> {
            if (error != null) {
                errorReporter.report(operation, typeNameOf(object), error);
            }
        });
        return Futures.unwrapped(result);
    }

    /**
     * 객체 하나 저장 (하위 저장 포함). 최상위와 하위 저장이 모두 거치는 경로입니다.
     */
    CompletableFuture<StoredRecord> saveObject(Persistable object, SaveChain chain) {
        return Futures.attempt(() -> {
            String kind = introspector.recordKindOf(object);
            Identity target = object.getIdentity()
                .orElseGet(() -> config.identityStrategy().identityFor(object, introspector).orElse(null));
            PreparedRecord prepared = new PreparedRecord(object, kind, target);
            List<FieldEntry> entries = introspector.fieldsOf(object);
            chain.enter(object);

            CompletableFuture<Void> fields = CompletableFuture.completedFuture(null);
            for (FieldEntry entry : entries) {
                fields = fields.thenCompose(ignored -> processField(prepared, entry, chain));
            }
            return fields
                .thenCompose(ignored -> persist(prepared, prepared.toRecord(), chain))
                .thenCompose(stored -> resolvePending(prepared, stored, chain))
                .whenComplete((stored, error) -> chain.leave(object));
        });
    }

    private CompletableFuture<Void> processField(PreparedRecord prepared, FieldEntry entry, SaveChain chain) {
        String typeName = prepared.getRecordKind();
        Optional<FieldKind> kind = codec.classify(typeName, entry);
        if (kind.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return switch (kind.get()) {
            case REFERENCE -> resolveSingle(prepared, entry.name(), (Persistable) entry.value(), chain);
            case REFERENCE_LIST -> resolveList(prepared, entry.name(), (List<?>) entry.value(), chain);
            default -> {
                prepared.put(entry.name(), codec.encodeLeaf(entry, kind.get()));
                yield CompletableFuture.completedFuture(null);
            }
        };
    }

    private CompletableFuture<Void> resolveSingle(PreparedRecord prepared, String field, Persistable target,
                                                  SaveChain chain) {
        Persistable parent = prepared.getSource();
        Optional<Identity> targetIdentity = target.getIdentity();

        // (a) 이미 저장되어 캐시에 있는 대상
        if (targetIdentity.isPresent() && cache.get(targetIdentity.get()).isPresent()) {
            prepared.put(field, ReferenceValue.to(targetIdentity.get()));
            return CompletableFuture.completedFuture(null);
        }
        // 같은 체인에서 저장 중인 대상은 다시 저장하지 않음
        if (chain.contains(target)) {
            if (chain.isAddressable(target)) {
                prepared.put(field, ReferenceValue.to(targetIdentity.get()));
            } else {
                defer(prepared, field, target);
            }
            return CompletableFuture.completedFuture(null);
        }
        // (b) 부모가 이미 주소를 가짐
        if (chain.isAddressable(parent)) {
            return saveBranch(prepared, field, target, chain)
                .thenAccept(identity -> prepared.put(field, ReferenceValue.to(identity)));
        }
        // (c) 대상에서 부모로 돌아오는 경로
        if (cycleDetector.hasPathBackTo(target, parent)) {
            defer(prepared, field, target);
            return CompletableFuture.completedFuture(null);
        }
        // (d) 분리된 참조
        return switch (config.detachedReferencePolicy()) {
            case SKIP -> {
                log.warn("Skipping reference field '{}' of unsaved {}: target is neither cached nor cyclic",
                    field, prepared.getRecordKind());
                yield CompletableFuture.completedFuture(null);
            }
            case DEFER -> {
                defer(prepared, field, target);
                yield CompletableFuture.completedFuture(null);
            }
            case SAVE_FIRST -> saveBranch(prepared, field, target, chain)
                .thenAccept(identity -> prepared.put(field, ReferenceValue.to(identity)));
        };
    }

    private CompletableFuture<Void> resolveList(PreparedRecord prepared, String field, List<?> elements,
                                                SaveChain chain) {
        List<Identity> identities = new ArrayList<>();
        CompletableFuture<Void> resolved = CompletableFuture.completedFuture(null);
        for (int i = 0; i < elements.size(); i++) {
            Persistable element = (Persistable) elements.get(i);
            String indexed = field + "[" + i + "]";
            resolved = resolved.thenCompose(ignored -> resolveElement(prepared, indexed, element, chain)
                .thenAccept(identities::add));
        }
        return resolved.thenRun(() -> prepared.put(field, ReferenceList.of(identities)));
    }

    private CompletableFuture<Identity> resolveElement(PreparedRecord prepared, String indexed, Persistable element,
                                                       SaveChain chain) {
        Optional<Identity> identity = element.getIdentity();
        if (identity.isPresent() && cache.get(identity.get()).isPresent()) {
            return CompletableFuture.completedFuture(identity.get());
        }
        if (chain.contains(element) && chain.isAddressable(element)) {
            return CompletableFuture.completedFuture(identity.get());
        }
        Persistable parent = prepared.getSource();
        boolean needsDeferral = chain.contains(element)
            || (!chain.isAddressable(parent) && cycleDetector.hasPathBackTo(element, parent));
        if (needsDeferral) {
            String elementKind = introspector.recordKindOf(element);
            return Futures.failed(new FieldProcessingFailedException(indexed, prepared.getRecordKind(),
                new ReferenceSavingFailedException(indexed, elementKind,
                    new CircularReferenceRejectedException(indexed, elementKind))));
        }
        return saveBranch(prepared, indexed, element, chain);
    }

    /**
     * 참조 대상을 저장하고 Identity를 반환. 실패는 필드 단위 오류로 감쌉니다.
     *
     * <p>다른 저장이 이미 Identity를 가진 대상을 저장 중이면 기다리지 않고 그 Identity를 바로 씁니다.</p>
     */
    private CompletableFuture<Identity> saveBranch(PreparedRecord prepared, String field, Persistable target,
                                                   SaveChain chain) {
        String typeName = prepared.getRecordKind();
        CompletableFuture<StoredRecord> branch;
        if (chain.contains(target)) {
            branch = saveObject(target, chain);
        } else {
            Optional<CompletableFuture<StoredRecord>> joined =
                registry.runNested(target, () -> saveObject(target, chain));
            if (joined.isEmpty()) {
                Identity identity = target.getIdentity().orElseThrow();
                log.debug("Referencing {}.{} -> {} while another save writes it", typeName, field, identity.getValue());
                return CompletableFuture.completedFuture(identity);
            }
            branch = joined.get();
        }
        return branch.handle((stored, error) -> {
            if (error != null) {
                String targetKind = target.getClass().getSimpleName();
                throw new FieldProcessingFailedException(field, typeName,
                    new ReferenceSavingFailedException(field, targetKind, Futures.unwrap(error)));
            }
            return stored.getIdentity().orElseThrow(() -> new FieldProcessingFailedException(field, typeName,
                new InvalidReferenceException(field, typeName)));
        });
    }

    private CompletableFuture<StoredRecord> resolvePending(PreparedRecord prepared, StoredRecord stored,
                                                           SaveChain chain) {
        if (!prepared.hasPending()) {
            return CompletableFuture.completedFuture(stored);
        }
        CompletableFuture<StoredRecord> patched = CompletableFuture.completedFuture(stored);
        for (PendingReference reference : prepared.getPending()) {
            patched = patched.thenCompose(current -> pendingIdentity(prepared, reference, chain)
                .thenApply(identity -> {
                    log.debug("Patching deferred reference {}.{} -> {}",
                        prepared.getRecordKind(), reference.fieldName(), identity.getValue());
                    return PreparedRecord.patch(current, reference, identity);
                }));
        }
        return patched.thenCompose(record -> persist(prepared, record, chain));
    }

    private CompletableFuture<Identity> pendingIdentity(PreparedRecord prepared, PendingReference reference,
                                                        SaveChain chain) {
        Persistable target = reference.target();
        Optional<Identity> identity = target.getIdentity();
        if (chain.contains(target) && chain.isAddressable(target)
                || identity.isPresent() && cache.get(identity.get()).isPresent()) {
            return CompletableFuture.completedFuture(identity.get());
        }
        return saveBranch(prepared, reference.fieldName(), target, chain);
    }

    /**
     * 레코드 저장 후 원본 객체에 Identity/시스템 속성을 반영하고 캐시.
     */
    private CompletableFuture<StoredRecord> persist(PreparedRecord prepared, StoredRecord record, SaveChain chain) {
        Persistable source = prepared.getSource();
        return Futures.attempt(() -> store.save(record))
            .handle((stored, error) -> {
                if (error != null) {
                    throw new StoreOperationFailedException("save", prepared.getRecordKind(), Futures.unwrap(error));
                }
                adopt(source, stored);
                registry.identityAssigned(source);
                chain.markPersisted(source);
                cache.put(stored);
                return stored;
            });
    }

    private void defer(PreparedRecord prepared, String field, Persistable target) {
        log.debug("Deferring reference {}.{} until both ends exist", prepared.getRecordKind(), field);
        prepared.defer(new PendingReference(field, target));
    }

    private static void adopt(Persistable object, StoredRecord stored) {
        stored.getIdentity().ifPresent(object::assignIdentity);
        object.applySystemAttributes(stored.getSystemAttributes());
    }

    private String kindOf(Persistable object) {
        return introspector.recordKindOf(object);
    }

    private String typeNameOf(Persistable object) {
        try {
            return introspector.recordKindOf(object);
        } catch (IllegalArgumentException e) {
            return object.getClass().getSimpleName();
        }
    }

    private static void requireObject(Persistable object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
    }
}

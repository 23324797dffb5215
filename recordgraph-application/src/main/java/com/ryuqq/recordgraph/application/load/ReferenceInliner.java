package com.ryuqq.recordgraph.application.load;

import com.ryuqq.recordgraph.application.cache.RecordCache;
import com.ryuqq.recordgraph.application.support.Futures;
import com.ryuqq.recordgraph.core.codec.CycleMarker;
import com.ryuqq.recordgraph.core.codec.RecordCodec;
import com.ryuqq.recordgraph.core.model.FieldValue;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.ReferenceList;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.spi.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 레코드의 참조를 대상 레코드 맵으로 인라인.
 *
 * <p>참조는 캐시, 없으면 Store에서 가져와 재귀적으로 인라인합니다. 하나의 "해결 중" Identity 집합을
 * 전체 인라인에 걸쳐 공유하며, 이미 본 Identity를 다시 만나면 재귀 대신
 * {@code {identity, isCycle:true}} 마커를 넣습니다. 가져올 수 없는 참조는 빠진 값으로 남기고
 * WARN 로그를 남깁니다.</p>
 *
 * <p>참조 해결은 하나씩 순서대로 기다립니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class ReferenceInliner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceInliner.class);

    private final Store store;
    private final RecordCache cache;
    private final RecordCodec codec;

    public ReferenceInliner(Store store, RecordCache cache, RecordCodec codec) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.store = store;
        this.cache = cache;
        this.codec = codec;
    }

    /**
     * 레코드를 참조가 인라인된 정제 맵으로 변환.
     *
     * @param record 시작 레코드
     * @return 정제된 맵
     */
    public CompletableFuture<Map<String, Object>> inline(StoredRecord record) {
        Set<Identity> resolving = new HashSet<>();
        record.getIdentity().ifPresent(resolving::add);
        return inline(record, resolving).thenApply(codec::sanitize);
    }

    private CompletableFuture<Map<String, Object>> inline(StoredRecord record, Set<Identity> resolving) {
        Map<String, Object> wire = codec.toWireMap(record);
        CompletableFuture<Void> done = CompletableFuture.completedFuture(null);
        for (Map.Entry<String, FieldValue> field : record.getFields().entrySet()) {
            String name = field.getKey();
            FieldValue value = field.getValue();
            if (value instanceof ReferenceValue reference) {
                done = done.thenCompose(ignored -> resolve(reference.identity(), resolving)
                    .thenAccept(inlined -> {
                        if (inlined.isPresent()) {
                            wire.put(name, inlined.get());
                        } else {
                            wire.remove(name);
                        }
                    }));
            } else if (value instanceof ReferenceList references) {
                List<Object> elements = new ArrayList<>();
                for (Identity identity : references.identities()) {
                    done = done.thenCompose(ignored -> resolve(identity, resolving)
                        .thenAccept(inlined -> inlined.ifPresent(elements::add)));
                }
                done = done.thenRun(() -> wire.put(name, elements));
            }
        }
        return done.thenApply(ignored -> wire);
    }

    private CompletableFuture<Optional<Object>> resolve(Identity identity, Set<Identity> resolving) {
        if (!resolving.add(identity)) {
            return CompletableFuture.completedFuture(Optional.of(CycleMarker.of(identity)));
        }
        Optional<StoredRecord> cached = cache.get(identity);
        CompletableFuture<StoredRecord> child = cached.isPresent()
            ? CompletableFuture.completedFuture(cached.get())
            : Futures.attempt(() -> store.fetch(identity)).thenApply(fetched -> {
                cache.put(fetched);
                return fetched;
            });
        return child
            .thenCompose(record -> inline(record, resolving))
            .handle((inlined, error) -> {
                if (error != null) {
                    log.warn("Could not resolve reference {}: {}", identity.getValue(),
                        Futures.unwrap(error).getMessage());
                    return Optional.empty();
                }
                return Optional.<Object>of(inlined);
            });
    }
}

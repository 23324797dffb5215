package com.ryuqq.recordgraph.application.save;

import com.ryuqq.recordgraph.core.model.FieldValue;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.Persistable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 저장 준비 중인 레코드.
 *
 * <p>필드를 하나씩 처리하며 값을 채우고, 지연된 참조를 모읍니다. 저장 한 번 동안만 쓰이며
 * 해당 저장 체인 안에서 순차적으로만 접근됩니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class PreparedRecord {

    private final Persistable source;
    private final String recordKind;
    private final Identity targetIdentity;
    private final Map<String, FieldValue> fields = new LinkedHashMap<>();
    private final List<PendingReference> pending = new ArrayList<>();

    /**
     * @param source 저장할 객체
     * @param recordKind 레코드 종류
     * @param targetIdentity 저장할 Identity (Store가 생성해야 하면 null)
     */
    public PreparedRecord(Persistable source, String recordKind, Identity targetIdentity) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (recordKind == null || recordKind.isBlank()) {
            throw new IllegalArgumentException("recordKind cannot be null or blank");
        }
        this.source = source;
        this.recordKind = recordKind;
        this.targetIdentity = targetIdentity;
    }

    public Persistable getSource() {
        return source;
    }

    public String getRecordKind() {
        return recordKind;
    }

    public Optional<Identity> getTargetIdentity() {
        return Optional.ofNullable(targetIdentity);
    }

    public void put(String fieldName, FieldValue value) {
        fields.put(fieldName, value);
    }

    public void defer(PendingReference reference) {
        pending.add(reference);
    }

    public List<PendingReference> getPending() {
        return Collections.unmodifiableList(pending);
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    /**
     * 지금까지 채운 필드로 레코드 생성.
     */
    public StoredRecord toRecord() {
        StoredRecord.Builder builder = StoredRecord.builder(recordKind).identity(targetIdentity);
        fields.forEach(builder::field);
        return builder.build();
    }

    /**
     * 저장된 레코드에 지연 참조를 채운 사본 생성.
     *
     * @param stored 1단계에서 저장된 레코드
     * @param reference 지연 참조
     * @param identity 대상이 저장되며 받은 Identity
     * @return 패치된 레코드
     */
    static StoredRecord patch(StoredRecord stored, PendingReference reference, Identity identity) {
        return stored.withField(reference.fieldName(), ReferenceValue.to(identity));
    }
}

package com.ryuqq.recordgraph.core.query;

import com.ryuqq.recordgraph.core.model.FieldValue;
import com.ryuqq.recordgraph.core.model.PrimitiveValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * 정렬 키.
 *
 * <p>문자열 표기에서는 마지막 문자가 {@code ⇩}이면 내림차순입니다
 * (예: {@code "createdOn⇩"}).</p>
 *
 * @param field 정렬 기준 필드
 * @param ascending 오름차순 여부
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record SortKey(String field, boolean ascending) {

    /**
     * 내림차순 표기 문자.
     */
    public static final char DESCENDING_MARK = '⇩';

    public SortKey {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
    }

    public static SortKey ascending(String field) {
        return new SortKey(field, true);
    }

    public static SortKey descending(String field) {
        return new SortKey(field, false);
    }

    /**
     * 문자열 표기에서 SortKey 생성.
     *
     * @param text 필드 이름 (끝에 ⇩가 있으면 내림차순)
     * @return SortKey
     */
    public static SortKey parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text cannot be null or blank");
        }
        if (text.charAt(text.length() - 1) == DESCENDING_MARK) {
            return descending(text.substring(0, text.length() - 1));
        }
        return ascending(text);
    }

    /**
     * 정렬 키 목록으로 레코드 비교자 생성.
     *
     * <p>필드가 없거나 비교할 수 없는 값은 뒤로 정렬됩니다.</p>
     *
     * @param sortKeys 정렬 키 목록 (앞쪽 키 우선)
     * @return 레코드 비교자
     */
    public static Comparator<StoredRecord> comparator(List<SortKey> sortKeys) {
        Comparator<StoredRecord> result = (a, b) -> 0;
        for (SortKey key : sortKeys) {
            result = result.thenComparing(key.comparator());
        }
        return result;
    }

    private Comparator<StoredRecord> comparator() {
        Comparator<StoredRecord> byField = (a, b) -> {
            Object left = valueOf(a);
            Object right = valueOf(b);
            if (left == null && right == null) return 0;
            if (left == null) return ascending ? 1 : -1;
            if (right == null) return ascending ? -1 : 1;
            return compareValues(left, right);
        };
        return ascending ? byField : byField.reversed();
    }

    private Object valueOf(StoredRecord record) {
        FieldValue value = record.getField(field).orElse(null);
        return value instanceof PrimitiveValue primitive ? primitive.value() : null;
    }

    /**
     * 같은 종류끼리는 자연 순서, 종류가 다르면 클래스 이름 순.
     */
    private static int compareValues(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return l.compareTo(r);
        }
        if (left instanceof Instant l && right instanceof Instant r) {
            return l.compareTo(r);
        }
        return left.getClass().getName().compareTo(right.getClass().getName());
    }

    @Override
    public String toString() {
        return ascending ? field : field + DESCENDING_MARK;
    }
}

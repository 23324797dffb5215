package com.ryuqq.recordgraph.core.error;

/**
 * 지원하지 않는 필드 타입.
 *
 * <p>원시 값, 바이트 배열, Persistable 객체 및 이들의 리스트가 아닌 값을 만났을 때 발생합니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class UnsupportedFieldTypeException extends PersistenceException {

    private final String kind;

    public UnsupportedFieldTypeException(String fieldName, String typeName, String kind) {
        super("Invalid field '" + fieldName + "' in type '" + typeName + "': Unsupported type: " + kind,
                fieldName, typeName, null);
        this.kind = kind;
    }

    /**
     * 지원하지 않는 값의 런타임 종류.
     *
     * @return 종류 (예: java.util.HashMap)
     */
    public String getKind() {
        return kind;
    }
}

package com.ryuqq.recordgraph.core.error;

/**
 * RecordGraph 영속화 오류의 최상위 예외.
 *
 * <p>호출자에게 노출되는 모든 오류는 가능한 경우 원인이 된 필드 이름과 타입 이름을 보존하여,
 * 내부를 들여다보지 않고도 정확한 진단이 가능하도록 합니다.</p>
 *
 * <p><strong>하위 예외:</strong></p>
 * <ul>
 *   <li>저장 시: {@link FieldProcessingFailedException}, {@link UnsupportedFieldTypeException},
 *       {@link InvalidReferenceException}, {@link ReferenceSavingFailedException},
 *       {@link RecordAlreadyExistsException}, {@link RecordDoesNotExistException}</li>
 *   <li>조회 시: {@link RecordNotFoundException}, {@link MappingException},
 *       {@link CircularReferenceRejectedException}</li>
 *   <li>공통: {@link StoreOperationFailedException}</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public abstract class PersistenceException extends RuntimeException {

    private final String fieldName;
    private final String typeName;

    protected PersistenceException(String message, String fieldName, String typeName, Throwable cause) {
        super(message, cause);
        this.fieldName = fieldName;
        this.typeName = typeName;
    }

    /**
     * 오류가 발생한 필드 이름.
     *
     * @return 필드 이름 (필드와 무관한 오류면 null)
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * 오류가 발생한 타입 이름 (레코드 종류).
     *
     * @return 타입 이름 (알 수 없으면 null)
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * 원인 예외의 메시지 (메시지가 없으면 클래스 이름).
     */
    static String describeCause(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }
}

package com.ryuqq.recordgraph.core.error;

/**
 * Store 연산 실패 (원인 예외를 감쌈).
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class StoreOperationFailedException extends PersistenceException {

    private final String operation;

    public StoreOperationFailedException(String operation, String typeName, Throwable cause) {
        super("Operation '" + operation + "' failed for type '" + typeName + "': " + describeCause(cause),
                null, typeName, cause);
        this.operation = operation;
    }

    /**
     * 실패한 연산 이름 (save, fetch, delete, query, upsert-check).
     *
     * @return 연산 이름
     */
    public String getOperation() {
        return operation;
    }
}

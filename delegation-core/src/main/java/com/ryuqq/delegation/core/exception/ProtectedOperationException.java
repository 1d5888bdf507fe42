package com.ryuqq.delegation.core.exception;

/**
 * PROTECTED 이름의 Operation을 제거하려는 경우 (silent=false).
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class ProtectedOperationException extends DelegationException {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "DLG-OP-PROTECTED";

    private final String operationName;

    /**
     * 생성자.
     *
     * @param operationName Operation 이름
     */
    public ProtectedOperationException(String operationName) {
        super(ERROR_CODE, "Operation '" + operationName + "' is protected and cannot be removed");
        this.operationName = operationName;
    }

    /**
     * Operation 이름 조회.
     *
     * @return Operation 이름
     */
    public String getOperationName() {
        return operationName;
    }
}

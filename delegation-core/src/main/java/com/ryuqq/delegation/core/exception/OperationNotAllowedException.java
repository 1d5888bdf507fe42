package com.ryuqq.delegation.core.exception;

/**
 * ELIGIBLE 집합 밖의 이름으로 Operation을 등록하려는 경우 (silent=false).
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class OperationNotAllowedException extends DelegationException {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "DLG-OP-NOT-ALLOWED";

    private final String operationName;

    /**
     * 생성자.
     *
     * @param operationName Operation 이름
     */
    public OperationNotAllowedException(String operationName) {
        super(ERROR_CODE, "Operation '" + operationName + "' is not in the list of eligible operations");
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

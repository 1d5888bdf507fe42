package com.ryuqq.delegation.core.exception;

/**
 * Hierarchy 어디에도 속성이 없고 errorIfMissing이 활성화된 경우 (읽기/쓰기).
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class MissingPropertyException extends DelegationException {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "DLG-MISSING";

    private final String key;

    /**
     * 생성자.
     *
     * @param key 속성 이름
     */
    public MissingPropertyException(String key) {
        super(ERROR_CODE, "Property not found in hierarchy: " + key);
        this.key = key;
    }

    /**
     * 속성 이름 조회.
     *
     * @return 속성 이름
     */
    public String getKey() {
        return key;
    }
}

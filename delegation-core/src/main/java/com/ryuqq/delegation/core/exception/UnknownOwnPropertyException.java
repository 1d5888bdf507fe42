package com.ryuqq.delegation.core.exception;

/**
 * 자체 저장소에 없는 속성을 silent=false로 삭제하려는 경우.
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class UnknownOwnPropertyException extends DelegationException {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "DLG-OWN";

    private final String key;

    /**
     * 생성자.
     *
     * @param key 속성 이름
     */
    public UnknownOwnPropertyException(String key) {
        super(ERROR_CODE, "Own property not present: " + key);
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

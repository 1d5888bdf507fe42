package com.ryuqq.delegation.core.exception;

/**
 * Source 목록에 없는 Source를 silent=false로 제거하려는 경우.
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class UnknownSourceException extends DelegationException {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "DLG-SOURCE";

    private final transient Object source;

    /**
     * 생성자.
     *
     * @param source 제거하려던 Source
     */
    public UnknownSourceException(Object source) {
        super(ERROR_CODE, "Source does not exist in hierarchy: " + source);
        this.source = source;
    }

    /**
     * 제거하려던 Source 조회.
     *
     * @return Source (Source 목록에 없는 객체)
     */
    public Object getSource() {
        return source;
    }
}

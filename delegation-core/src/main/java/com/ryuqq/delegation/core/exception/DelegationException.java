package com.ryuqq.delegation.core.exception;

/**
 * Composite 위임 실패의 공통 상위 예외.
 *
 * <p>모든 위임 오류는 동기적으로 발생하며, 현재 호출만 중단시키고 재시도되지 않습니다.
 * 각 하위 예외는 고정된 오류 코드를 가집니다.</p>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>DLG-DUPLICATE: 중복 속성 읽기 ({@link DuplicatePropertyException})</li>
 *   <li>DLG-MISSING: 속성 없음 ({@link MissingPropertyException})</li>
 *   <li>DLG-OVERRIDE: 덮어쓰기 금지 ({@link OverrideDisallowedException})</li>
 *   <li>DLG-DELETE: Source 삭제 금지 ({@link DeletionDisallowedException})</li>
 *   <li>DLG-SOURCE: 알 수 없는 Source ({@link UnknownSourceException})</li>
 *   <li>DLG-OWN: 알 수 없는 자체 속성 ({@link UnknownOwnPropertyException})</li>
 *   <li>DLG-OP-NOT-ALLOWED: 등록 불가 Operation ({@link OperationNotAllowedException})</li>
 *   <li>DLG-OP-PROTECTED: 보호된 Operation ({@link ProtectedOperationException})</li>
 * </ul>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public abstract class DelegationException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드 (예: DLG-MISSING)
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    protected DelegationException(String errorCode, String message) {
        super(message);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }
}

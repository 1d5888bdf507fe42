package com.ryuqq.delegation.core.model;

/**
 * 확장 Operation 이름의 분류.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>ELIGIBLE: 레지스트리에 추가/제거/덮어쓰기 가능</li>
 *   <li>PROTECTED: 추가/제거/덮어쓰기 불가 (호출자 의도와 무관)</li>
 * </ul>
 *
 * <p>두 분류는 서로 배타적이며 프로그램 수명 동안 고정됩니다.</p>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public enum OperationCategory {

    /**
     * 확장 가능 (레지스트리 등록 허용).
     */
    ELIGIBLE,

    /**
     * 보호됨 (레지스트리 등록/제거 금지).
     */
    PROTECTED
}

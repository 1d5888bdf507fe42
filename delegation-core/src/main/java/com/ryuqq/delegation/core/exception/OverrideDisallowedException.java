package com.ryuqq.delegation.core.exception;

/**
 * 덮어쓰기 금지 위반.
 *
 * <p>allowOverride=false 상태에서 자체 저장소에 새 속성을 만들려는 경우 발생합니다.</p>
 * <ul>
 *   <li>set(): Hierarchy에 없는 키를 쓰려는 경우 (errorIfMissing=false)</li>
 *   <li>addOwnProperty(): Hierarchy에 이미 존재하는 키를 추가하려는 경우</li>
 * </ul>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class OverrideDisallowedException extends DelegationException {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "DLG-OVERRIDE";

    private final String key;

    /**
     * 생성자.
     *
     * @param key 속성 이름
     */
    public OverrideDisallowedException(String key) {
        super(ERROR_CODE, "Overriding properties of the hierarchy is disallowed: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

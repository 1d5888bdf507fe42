package com.ryuqq.delegation.core.exception;

/**
 * 중복 속성 읽기 실패.
 *
 * <p>자체 저장소에 없는 속성을 읽을 때 두 개 이상의 Source가 해당 속성을 가지고 있고,
 * duplicationAllowed=false인 경우 발생합니다.</p>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class DuplicatePropertyException extends DelegationException {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "DLG-DUPLICATE";

    private final String key;
    private final int occurrences;

    /**
     * 생성자.
     *
     * @param key 속성 이름
     * @param occurrences 속성을 가진 Source 수 (2 이상)
     */
    public DuplicatePropertyException(String key, int occurrences) {
        super(ERROR_CODE, "Property '" + key + "' exists in " + occurrences
            + " sources. Duplication of properties in the hierarchy is disallowed.");
        this.key = key;
        this.occurrences = occurrences;
    }

    public String getKey() {
        return key;
    }

    public int getOccurrences() {
        return occurrences;
    }
}

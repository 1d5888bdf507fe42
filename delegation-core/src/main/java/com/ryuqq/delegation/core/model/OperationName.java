package com.ryuqq.delegation.core.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Operation 이름의 닫힌 집합.
 *
 * <p>Composite의 Operation 레지스트리는 이 enum에 정의된 이름만 키로 사용합니다.
 * 임의의 문자열 이름은 허용되지 않습니다.</p>
 *
 * <p><strong>ELIGIBLE (9개):</strong></p>
 * <ul>
 *   <li>apply, construct, defineProperty, deleteProperty, getOwnPropertyDescriptor</li>
 *   <li>getPrototypeOf, isExtensible, preventExtensions, setPrototypeOf</li>
 * </ul>
 *
 * <p><strong>PROTECTED (4개):</strong></p>
 * <ul>
 *   <li>get, set, has, ownKeys</li>
 * </ul>
 *
 * <p><strong>필수 Operation과의 관계:</strong></p>
 * <p>필수 Operation 5개(has, get, set, ownKeys, delete)는 Composite가 직접 구현하며
 * 레지스트리 엔트리가 되지 않습니다. 그 중 4개는 PROTECTED 이름과 일치합니다.
 * 나머지 하나인 delete는 ELIGIBLE 이름 {@link #DELETE_PROPERTY}와 겹치는데,
 * {@code deleteProperty}로 등록된 콜백은 확장 훅일 뿐 {@code Composite.delete(String)}를
 * 대체하지 않습니다. PROTECTED 4개 집합이 기준입니다.</p>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public enum OperationName {

    APPLY("apply", OperationCategory.ELIGIBLE),
    CONSTRUCT("construct", OperationCategory.ELIGIBLE),
    DEFINE_PROPERTY("defineProperty", OperationCategory.ELIGIBLE),
    DELETE_PROPERTY("deleteProperty", OperationCategory.ELIGIBLE),
    GET_OWN_PROPERTY_DESCRIPTOR("getOwnPropertyDescriptor", OperationCategory.ELIGIBLE),
    GET_PROTOTYPE_OF("getPrototypeOf", OperationCategory.ELIGIBLE),
    IS_EXTENSIBLE("isExtensible", OperationCategory.ELIGIBLE),
    PREVENT_EXTENSIONS("preventExtensions", OperationCategory.ELIGIBLE),
    SET_PROTOTYPE_OF("setPrototypeOf", OperationCategory.ELIGIBLE),

    GET("get", OperationCategory.PROTECTED),
    SET("set", OperationCategory.PROTECTED),
    HAS("has", OperationCategory.PROTECTED),
    OWN_KEYS("ownKeys", OperationCategory.PROTECTED);

    private final String value;
    private final OperationCategory category;

    OperationName(String value, OperationCategory category) {
        this.value = value;
        this.category = category;
    }

    /**
     * 문자열 이름 조회.
     *
     * @return 이름 (예: "apply", "ownKeys")
     */
    public String getValue() {
        return value;
    }

    /**
     * 분류 조회.
     *
     * @return ELIGIBLE 또는 PROTECTED
     */
    public OperationCategory getCategory() {
        return category;
    }

    /**
     * 확장 가능한 이름인지 확인.
     *
     * @return ELIGIBLE인 경우 true
     */
    public boolean isEligible() {
        return category == OperationCategory.ELIGIBLE;
    }

    /**
     * 보호된 이름인지 확인.
     *
     * @return PROTECTED인 경우 true
     */
    public boolean isProtected() {
        return category == OperationCategory.PROTECTED;
    }

    /**
     * 문자열 이름으로 조회.
     *
     * <p>대소문자를 구분합니다. 닫힌 집합에 없는 이름은 빈 Optional을 반환합니다.</p>
     *
     * @param value 문자열 이름 (예: "defineProperty")
     * @return 일치하는 OperationName (없으면 empty)
     */
    public static Optional<OperationName> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(name -> name.value.equals(value))
            .findFirst();
    }

    /**
     * 분류에 속한 이름 집합 조회.
     *
     * @param category 분류
     * @return 새 EnumSet (호출자가 수정해도 안전)
     * @throws IllegalArgumentException category가 null인 경우
     */
    public static Set<OperationName> of(OperationCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        Set<OperationName> names = EnumSet.noneOf(OperationName.class);
        for (OperationName name : values()) {
            if (name.category == category) {
                names.add(name);
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return value;
    }
}

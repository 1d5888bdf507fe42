package com.ryuqq.delegation.core.policy;

/**
 * Composite 생성 설정 (불변 record).
 *
 * <p>Composite 생성 시점의 정책 플래그 초기값을 담고 있습니다.
 * 생성 이후의 변경은 Composite의 setter로 수행합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>duplicationAllowed: 여러 Source에 같은 속성이 있어도 읽기 허용 (기본 true)</li>
 *   <li>errorIfMissing: 속성이 없을 때 예외 발생 (기본 false)</li>
 *   <li>allowOverride: 자체 저장소에 새 속성 생성 허용 (기본 true)</li>
 *   <li>allowDeletion: Source에 있는 속성 삭제 허용 (기본 false)</li>
 * </ul>
 *
 * @author Delegation Team
 * @since 1.0.0
 * @param duplicationAllowed 중복 허용 여부
 * @param errorIfMissing 속성 없음 시 예외 여부
 * @param allowOverride 덮어쓰기 허용 여부
 * @param allowDeletion Source 속성 삭제 허용 여부
 */
public record CompositeConfig(
    boolean duplicationAllowed,
    boolean errorIfMissing,
    boolean allowOverride,
    boolean allowDeletion
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: duplicationAllowed=true, errorIfMissing=false, allowOverride=true, allowDeletion=false</p>
     */
    public CompositeConfig() {
        this(true, false, true, false);
    }

    /**
     * 기본 설정 조회.
     *
     * @return 기본값으로 구성된 CompositeConfig
     */
    public static CompositeConfig defaults() {
        return new CompositeConfig();
    }

    /**
     * duplicationAllowed만 변경한 새 인스턴스 생성.
     *
     * @param duplicationAllowed 새 값
     * @return 새 CompositeConfig 인스턴스
     */
    public CompositeConfig withDuplicationAllowed(boolean duplicationAllowed) {
        return new CompositeConfig(duplicationAllowed, errorIfMissing, allowOverride, allowDeletion);
    }

    /**
     * errorIfMissing만 변경한 새 인스턴스 생성.
     *
     * @param errorIfMissing 새 값
     * @return 새 CompositeConfig 인스턴스
     */
    public CompositeConfig withErrorIfMissing(boolean errorIfMissing) {
        return new CompositeConfig(duplicationAllowed, errorIfMissing, allowOverride, allowDeletion);
    }

    /**
     * allowOverride만 변경한 새 인스턴스 생성.
     *
     * @param allowOverride 새 값
     * @return 새 CompositeConfig 인스턴스
     */
    public CompositeConfig withAllowOverride(boolean allowOverride) {
        return new CompositeConfig(duplicationAllowed, errorIfMissing, allowOverride, allowDeletion);
    }

    /**
     * allowDeletion만 변경한 새 인스턴스 생성.
     *
     * @param allowDeletion 새 값
     * @return 새 CompositeConfig 인스턴스
     */
    public CompositeConfig withAllowDeletion(boolean allowDeletion) {
        return new CompositeConfig(duplicationAllowed, errorIfMissing, allowOverride, allowDeletion);
    }
}

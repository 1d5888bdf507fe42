package com.ryuqq.delegation.core.policy;

/**
 * Composite 인스턴스별 정책 플래그 (가변).
 *
 * <p>네 개의 독립적인 boolean 값으로, 변경 즉시 다음 Operation부터 적용됩니다.
 * 기존 상태를 소급하여 재검증하지 않습니다.</p>
 *
 * <p>이 플래그들은 Composite의 private 상태이며 {@code keys()} 결과에 나타나지 않습니다.</p>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public final class PolicyFlags {

    private boolean duplicationAllowed;
    private boolean errorIfMissing;
    private boolean allowOverride;
    private boolean allowDeletion;

    /**
     * 설정값으로 초기화.
     *
     * @param config 초기 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public PolicyFlags(CompositeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.duplicationAllowed = config.duplicationAllowed();
        this.errorIfMissing = config.errorIfMissing();
        this.allowOverride = config.allowOverride();
        this.allowDeletion = config.allowDeletion();
    }

    public boolean isDuplicationAllowed() {
        return duplicationAllowed;
    }

    public void setDuplicationAllowed(boolean duplicationAllowed) {
        this.duplicationAllowed = duplicationAllowed;
    }

    public boolean isErrorIfMissing() {
        return errorIfMissing;
    }

    public void setErrorIfMissing(boolean errorIfMissing) {
        this.errorIfMissing = errorIfMissing;
    }

    public boolean isAllowOverride() {
        return allowOverride;
    }

    public void setAllowOverride(boolean allowOverride) {
        this.allowOverride = allowOverride;
    }

    public boolean isAllowDeletion() {
        return allowDeletion;
    }

    public void setAllowDeletion(boolean allowDeletion) {
        this.allowDeletion = allowDeletion;
    }

    /**
     * 현재 플래그 값의 스냅샷.
     *
     * @return 현재 값으로 구성된 CompositeConfig
     */
    public CompositeConfig snapshot() {
        return new CompositeConfig(duplicationAllowed, errorIfMissing, allowOverride, allowDeletion);
    }

    @Override
    public String toString() {
        return "PolicyFlags{" +
            "duplicationAllowed=" + duplicationAllowed +
            ", errorIfMissing=" + errorIfMissing +
            ", allowOverride=" + allowOverride +
            ", allowDeletion=" + allowDeletion +
            '}';
    }
}

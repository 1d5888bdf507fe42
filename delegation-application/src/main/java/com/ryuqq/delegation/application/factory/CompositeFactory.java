package com.ryuqq.delegation.application.factory;

import com.ryuqq.delegation.core.composite.Composite;
import com.ryuqq.delegation.core.policy.CompositeConfig;
import com.ryuqq.delegation.core.spi.Source;

import java.util.List;

/**
 * Composite 생성 팩토리.
 *
 * <p>Source 목록과 정책 플래그(모두 선택)로 Composite를 생성합니다.
 * 생략된 값은 팩토리의 기본 설정을 따릅니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CompositeFactory factory = new DefaultCompositeFactory();
 *
 * Composite empty = factory.construct();
 * Composite car = factory.construct(List.of(engine, wheels));
 * Composite strict = factory.construct(
 *     List.of(engine, wheels),
 *     CompositeConfig.defaults().withDuplicationAllowed(false).withErrorIfMissing(true)
 * );
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public interface CompositeFactory {

    /**
     * Source 없이 기본 설정으로 생성.
     *
     * @return 새 Composite
     */
    default Composite construct() {
        return construct(List.of());
    }

    /**
     * 기본 설정으로 생성.
     *
     * @param sources 초기 Source 목록 (null이면 빈 목록)
     * @return 새 Composite
     * @throws IllegalArgumentException sources에 null 원소가 있는 경우
     */
    Composite construct(List<? extends Source> sources);

    /**
     * 지정한 설정으로 생성.
     *
     * @param sources 초기 Source 목록 (null이면 빈 목록)
     * @param config 정책 플래그 초기값
     * @return 새 Composite
     * @throws IllegalArgumentException config가 null이거나 sources에 null 원소가 있는 경우
     */
    Composite construct(List<? extends Source> sources, CompositeConfig config);

    /**
     * 플래그를 개별 지정하여 생성.
     *
     * @param sources 초기 Source 목록 (null이면 빈 목록)
     * @param duplicationAllowed 중복 허용 여부
     * @param errorIfMissing 속성 없음 시 예외 여부
     * @param allowOverride 덮어쓰기 허용 여부
     * @param allowDeletion Source 속성 삭제 허용 여부
     * @return 새 Composite
     */
    default Composite construct(List<? extends Source> sources,
                                boolean duplicationAllowed,
                                boolean errorIfMissing,
                                boolean allowOverride,
                                boolean allowDeletion) {
        return construct(sources, new CompositeConfig(duplicationAllowed, errorIfMissing, allowOverride, allowDeletion));
    }
}

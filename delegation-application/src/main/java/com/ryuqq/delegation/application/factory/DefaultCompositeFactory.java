package com.ryuqq.delegation.application.factory;

import com.ryuqq.delegation.core.composite.Composite;
import com.ryuqq.delegation.core.exception.OperationNotAllowedException;
import com.ryuqq.delegation.core.model.OperationName;
import com.ryuqq.delegation.core.policy.CompositeConfig;
import com.ryuqq.delegation.core.registry.OperationCallback;
import com.ryuqq.delegation.core.spi.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 기본 Composite 팩토리 구현.
 *
 * <p>기본 설정과 사전 등록 확장 Operation(preset)을 보관하고,
 * 생성하는 모든 Composite에 preset을 설치합니다.</p>
 *
 * <p><strong>Preset 검증:</strong></p>
 * <ul>
 *   <li>팩토리 생성 시점에 즉시 검증 (Fail-Fast)</li>
 *   <li>ELIGIBLE 이름이 아니면 {@link OperationNotAllowedException}</li>
 *   <li>null 콜백은 {@link IllegalArgumentException}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Map&lt;OperationName, OperationCallback&gt; presets = Map.of(
 *     OperationName.GET_PROTOTYPE_OF, (target, args) -&gt; List.copyOf(target.sources())
 * );
 * CompositeFactory factory = new DefaultCompositeFactory(CompositeConfig.defaults(), presets);
 *
 * Composite composite = factory.construct(List.of(source));
 * composite.invokeOperation(OperationName.GET_PROTOTYPE_OF); // [source]
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public final class DefaultCompositeFactory implements CompositeFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultCompositeFactory.class);

    private final CompositeConfig defaultConfig;
    private final Map<OperationName, OperationCallback> presetOperations;

    /**
     * 기본 설정, preset 없음.
     */
    public DefaultCompositeFactory() {
        this(CompositeConfig.defaults(), Map.of());
    }

    /**
     * 생성자.
     *
     * @param defaultConfig 설정을 생략한 construct 호출에 사용할 설정
     * @param presetOperations 생성하는 모든 Composite에 설치할 확장 Operation
     * @throws IllegalArgumentException 의존성이 null이거나 preset 콜백이 null인 경우
     * @throws OperationNotAllowedException preset 이름이 ELIGIBLE이 아닌 경우
     */
    public DefaultCompositeFactory(CompositeConfig defaultConfig,
                                   Map<OperationName, OperationCallback> presetOperations) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (presetOperations == null) {
            throw new IllegalArgumentException("presetOperations cannot be null");
        }
        Map<OperationName, OperationCallback> validated = new EnumMap<>(OperationName.class);
        for (Map.Entry<OperationName, OperationCallback> entry : presetOperations.entrySet()) {
            OperationName name = entry.getKey();
            if (name == null) {
                throw new IllegalArgumentException("preset operation name cannot be null");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("preset callback cannot be null: " + name);
            }
            if (!name.isEligible()) {
                throw new OperationNotAllowedException(name.getValue());
            }
            validated.put(name, entry.getValue());
        }
        this.defaultConfig = defaultConfig;
        this.presetOperations = Collections.unmodifiableMap(validated);
        log.info("CompositeFactory created: config={}, presets={}", defaultConfig, validated.keySet());
    }

    @Override
    public Composite construct(List<? extends Source> sources) {
        return construct(sources, defaultConfig);
    }

    @Override
    public Composite construct(List<? extends Source> sources, CompositeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        Composite composite = new Composite(sources, config);
        presetOperations.forEach((name, callback) -> composite.addOperation(name, callback, false));
        log.debug("Composite constructed with {} sources and {} preset operations",
            composite.sources().size(), presetOperations.size());
        return composite;
    }

    /**
     * 기본 설정 조회.
     *
     * @return 기본 설정
     */
    public CompositeConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * Preset 확장 Operation 조회.
     *
     * @return 읽기 전용 Map
     */
    public Map<OperationName, OperationCallback> getPresetOperations() {
        return presetOperations;
    }
}

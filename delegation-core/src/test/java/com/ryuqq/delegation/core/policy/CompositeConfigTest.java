package com.ryuqq.delegation.core.policy;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CompositeConfig / PolicyFlags 테스트.
 *
 * @author Delegation Team
 * @since 1.0.0
 */
class CompositeConfigTest {

    @Test
    void defaults_MatchDocumentedValues() {
        // when
        CompositeConfig config = CompositeConfig.defaults();

        // then
        assertThat(config.duplicationAllowed()).isTrue();
        assertThat(config.errorIfMissing()).isFalse();
        assertThat(config.allowOverride()).isTrue();
        assertThat(config.allowDeletion()).isFalse();
        assertThat(config).isEqualTo(new CompositeConfig());
    }

    @Test
    void withers_ChangeOnlyOneFlag() {
        // given
        CompositeConfig base = CompositeConfig.defaults();

        // when & then
        assertThat(base.withDuplicationAllowed(false)).isEqualTo(new CompositeConfig(false, false, true, false));
        assertThat(base.withErrorIfMissing(true)).isEqualTo(new CompositeConfig(true, true, true, false));
        assertThat(base.withAllowOverride(false)).isEqualTo(new CompositeConfig(true, false, false, false));
        assertThat(base.withAllowDeletion(true)).isEqualTo(new CompositeConfig(true, false, true, true));
        assertThat(base).isEqualTo(CompositeConfig.defaults());
    }

    @Test
    void policyFlags_InitializedFromConfig_SnapshotReflectsChanges() {
        // given
        PolicyFlags flags = new PolicyFlags(new CompositeConfig(false, true, false, true));

        // when
        flags.setDuplicationAllowed(true);
        flags.setAllowDeletion(false);

        // then
        assertThat(flags.isErrorIfMissing()).isTrue();
        assertThat(flags.isAllowOverride()).isFalse();
        assertThat(flags.snapshot()).isEqualTo(new CompositeConfig(true, true, false, false));
    }

    @Test
    void policyFlags_NullConfig_ThrowsException() {
        assertThatThrownBy(() -> new PolicyFlags(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }
}

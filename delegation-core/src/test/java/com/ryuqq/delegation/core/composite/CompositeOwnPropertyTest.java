package com.ryuqq.delegation.core.composite;

import com.ryuqq.delegation.core.exception.OverrideDisallowedException;
import com.ryuqq.delegation.core.exception.UnknownOwnPropertyException;
import com.ryuqq.delegation.core.policy.CompositeConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 자체 속성 관리 (addOwnProperty, deleteOwnProperty) 테스트.
 *
 * @author Delegation Team
 * @since 1.0.0
 */
class CompositeOwnPropertyTest {

    @Test
    void addOwnProperty_KeyInSource_OverrideAllowed_ShadowsSource() {
        // given
        StubSource a = StubSource.of("A", "foo", "a");
        Composite composite = new Composite(List.of(a));

        // when
        composite.addOwnProperty("foo", "own");

        // then
        assertThat(composite.get("foo")).isEqualTo("own");
        assertThat(a.get("foo")).isEqualTo("a");
    }

    @Test
    void addOwnProperty_KeyInSource_OverrideDisallowed_ThrowsOverrideDisallowed() {
        // given
        Composite composite = new Composite(List.of(StubSource.of("A", "foo", "a")),
            CompositeConfig.defaults().withAllowOverride(false));

        // when & then
        assertThatThrownBy(() -> composite.addOwnProperty("foo", "own"))
            .isInstanceOf(OverrideDisallowedException.class);
        assertThat(composite.hasOwnProperty("foo")).isFalse();
    }

    @Test
    void addOwnProperty_NewKey_OverrideDisallowed_Succeeds() {
        // given
        Composite composite = new Composite(List.of(), CompositeConfig.defaults().withAllowOverride(false));

        // when
        composite.addOwnProperty("fresh", 1);

        // then
        assertThat(composite.get("fresh")).isEqualTo(1);
    }

    @Test
    void deleteOwnProperty_Present_RemovesOnlyOwnCopy() {
        // given
        StubSource a = StubSource.of("A", "foo", "a");
        Composite composite = new Composite(List.of(a));
        composite.addOwnProperty("foo", "own");

        // when
        boolean deleted = composite.deleteOwnProperty("foo");

        // then
        assertThat(deleted).isTrue();
        assertThat(composite.get("foo")).isEqualTo("a");
    }

    @Test
    void deleteOwnProperty_KeyOnlyInSource_SilentReturnsFalse() {
        // given
        StubSource a = StubSource.of("A", "foo", "a");
        Composite composite = new Composite(List.of(a));

        // when & then
        assertThat(composite.deleteOwnProperty("foo")).isFalse();
        assertThat(a.has("foo")).isTrue();
    }

    @Test
    void deleteOwnProperty_Absent_NotSilent_ThrowsUnknownOwnProperty() {
        // given
        Composite composite = new Composite();

        // when & then
        assertThatThrownBy(() -> composite.deleteOwnProperty("ghost", false))
            .isInstanceOf(UnknownOwnPropertyException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    void ownPropertyNames_InsertionOrder() {
        // given
        Composite composite = new Composite();
        composite.addOwnProperty("b", 1);
        composite.addOwnProperty("a", 2);
        composite.set("c", 3);

        // when & then
        assertThat(composite.ownPropertyNames()).containsExactly("b", "a", "c");
    }
}

package com.ryuqq.delegation.core.composite;

import com.ryuqq.delegation.core.exception.DeletionDisallowedException;
import com.ryuqq.delegation.core.policy.CompositeConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Composite를 Source로 사용하는 재귀 합성 테스트.
 *
 * @author Delegation Team
 * @since 1.0.0
 */
class CompositeNestedTest {

    @Test
    void get_ResolvesThroughNestedComposite() {
        // given
        Composite inner = new Composite(List.of(StubSource.of("leaf", "bar", 2)));
        Composite outer = new Composite(List.of(inner, StubSource.of("B", "foo", 1)));

        // when & then
        assertThat(outer.get("bar")).isEqualTo(2);
        assertThat(outer.get("foo")).isEqualTo(1);
        assertThat(outer.keys()).containsExactly("bar", "foo");
    }

    @Test
    void set_OnOuter_DoesNotReachInnerComposite() {
        // given
        Composite inner = new Composite(List.of(StubSource.of("leaf", "bar", 2)));
        Composite outer = new Composite(List.of(inner));

        // when
        outer.set("bar", 3);

        // then
        assertThat(outer.get("bar")).isEqualTo(3);
        assertThat(inner.get("bar")).isEqualTo(2);
        assertThat(inner.ownPropertyNames()).isEmpty();
    }

    @Test
    void delete_BothLevelsAllowDeletion_RemovesFromLeaf() {
        // given
        StubSource leaf = StubSource.of("leaf", "bar", 2);
        Composite inner = new Composite(List.of(leaf), CompositeConfig.defaults().withAllowDeletion(true));
        Composite outer = new Composite(List.of(inner), CompositeConfig.defaults().withAllowDeletion(true));

        // when
        boolean deleted = outer.delete("bar");

        // then
        assertThat(deleted).isTrue();
        assertThat(leaf.has("bar")).isFalse();
    }

    @Test
    void delete_InnerDisallowsDeletion_ErrorPropagates() {
        // given
        StubSource leaf = StubSource.of("leaf", "bar", 2);
        Composite inner = new Composite(List.of(leaf));
        Composite outer = new Composite(List.of(inner), CompositeConfig.defaults().withAllowDeletion(true));

        // when & then
        assertThatThrownBy(() -> outer.delete("bar")).isInstanceOf(DeletionDisallowedException.class);
        assertThat(leaf.has("bar")).isTrue();
    }

    @Test
    void has_CyclicHierarchy_OverflowsStack() {
        // given
        Composite left = new Composite();
        Composite right = new Composite(List.of(left));
        left.addSource(right);

        // when & then
        assertThatThrownBy(() -> left.has("anything")).isInstanceOf(StackOverflowError.class);
    }
}

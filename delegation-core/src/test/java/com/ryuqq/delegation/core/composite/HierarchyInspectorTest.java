package com.ryuqq.delegation.core.composite;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HierarchyInspector 테스트.
 *
 * @author Delegation Team
 * @since 1.0.0
 */
class HierarchyInspectorTest {

    private Composite sample() {
        Composite composite = new Composite(List.of(
            StubSource.of("A", "foo", 1, "x", 1),
            StubSource.of("B", "foo", 2, "y", 2),
            StubSource.of("C", "y", 3, "z", 3)));
        composite.addOwnProperty("own", 0);
        return composite;
    }

    @Test
    void occurrenceCount_CountsOwnStorageAndEachSource() {
        // given
        Composite composite = sample();
        composite.addOwnProperty("foo", 0);

        // when & then
        assertThat(HierarchyInspector.occurrenceCount(composite, "foo")).isEqualTo(3);
        assertThat(HierarchyInspector.occurrenceCount(composite, "z")).isEqualTo(1);
        assertThat(HierarchyInspector.occurrenceCount(composite, "missing")).isZero();
    }

    @Test
    void duplicateNames_EachNameOnceInFirstSeenOrder() {
        // when
        List<String> duplicates = sample().duplicateNames();

        // then
        assertThat(duplicates).containsExactly("foo", "y");
    }

    @Test
    void uniqueNames_NamesSeenExactlyOnce() {
        // when
        List<String> unique = sample().uniqueNames();

        // then
        assertThat(unique).containsExactly("own", "x", "z");
    }

    @Test
    void duplicateAndUniqueNames_AreDisjointAndCoverEveryKey() {
        // given
        Composite composite = sample();

        // when
        List<String> duplicates = composite.duplicateNames();
        List<String> unique = composite.uniqueNames();

        // then
        assertThat(duplicates).doesNotContainAnyElementsOf(unique);
        List<String> union = new ArrayList<>(duplicates);
        union.addAll(unique);
        Set<String> distinct = new LinkedHashSet<>(composite.keys());
        assertThat(union).containsExactlyInAnyOrderElementsOf(distinct);
    }

    @Test
    void names_EmptyComposite_ReturnsEmptyLists() {
        // given
        Composite composite = new Composite();

        // when & then
        assertThat(composite.duplicateNames()).isEmpty();
        assertThat(composite.uniqueNames()).isEmpty();
    }
}

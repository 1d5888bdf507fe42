package com.ryuqq.delegation.core.composite;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name statistics over a Composite hierarchy.
 *
 * <p>All computations are flat: a Composite used as a source counts once for
 * {@link #occurrenceCount(Composite, String)}, while its enumeration still contributes
 * every name its own hierarchy reports to {@link #duplicateNames(Composite)} and
 * {@link #uniqueNames(Composite)}.</p>
 *
 * <p><strong>Invariant:</strong> duplicateNames and uniqueNames are disjoint and together
 * cover every distinct name in {@code composite.keys()}.</p>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public final class HierarchyInspector {

    // Utility class - prevent instantiation
    private HierarchyInspector() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Counts how many places in the hierarchy expose a property.
     *
     * @param composite the composite
     * @param key the property name
     * @return 1 if own storage has the key, plus 1 per immediate source that has it
     * @throws IllegalArgumentException if composite or key is null
     */
    public static int occurrenceCount(Composite composite, String key) {
        requireComposite(composite);
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        int counter = composite.hasOwnProperty(key) ? 1 : 0;
        for (var source : composite.sources()) {
            if (source.has(key)) {
                counter++;
            }
        }
        return counter;
    }

    /**
     * Names that appear two or more times in the full enumeration.
     *
     * @param composite the composite
     * @return each duplicated name once, in first-seen order
     * @throws IllegalArgumentException if composite is null
     */
    public static List<String> duplicateNames(Composite composite) {
        return namesWithCount(composite, true);
    }

    /**
     * Names that appear exactly once in the full enumeration.
     *
     * @param composite the composite
     * @return unique names in enumeration order
     * @throws IllegalArgumentException if composite is null
     */
    public static List<String> uniqueNames(Composite composite) {
        return namesWithCount(composite, false);
    }

    private static List<String> namesWithCount(Composite composite, boolean duplicated) {
        requireComposite(composite);
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String name : composite.keys()) {
            counts.merge(name, 1, Integer::sum);
        }
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            boolean isDuplicate = entry.getValue() >= 2;
            if (isDuplicate == duplicated) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    private static void requireComposite(Composite composite) {
        if (composite == null) {
            throw new IllegalArgumentException("composite cannot be null");
        }
    }
}

package com.ryuqq.delegation.testkit.contract;

import com.ryuqq.delegation.core.spi.Source;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract Contract Test for {@link Source} implementations.
 *
 * <p>Every Source that takes part in a Composite hierarchy must pass these tests.
 * Subclasses only provide a factory for a source seeded with given properties.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>has/get agree with the seeded properties; absent keys read as null</li>
 *   <li>keys() reports every seeded key and agrees with has()</li>
 *   <li>keys() returns a snapshot</li>
 *   <li>delete removes a present key (true) and is a no-op for an absent key (false)</li>
 *   <li>null keys are rejected with IllegalArgumentException</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MapSourceContractTest extends AbstractSourceContractTest {
 *     {@literal @}Override
 *     protected Source createSource(Map&lt;String, Object&gt; seed) {
 *         return MapSource.of(seed);
 *     }
 * }
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public abstract class AbstractSourceContractTest {

    /**
     * Creates the source under test.
     *
     * @param seed properties the source must expose (insertion ordered)
     * @return a fresh source; deleting a present key through it must be permitted
     */
    protected abstract Source createSource(Map<String, Object> seed);

    /**
     * Default seed: {@code alpha=1, beta="two", gamma=null}.
     */
    protected Map<String, Object> defaultSeed() {
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put("alpha", 1);
        seed.put("beta", "two");
        seed.put("gamma", null);
        return seed;
    }

    @Test
    void has_SeededKey_ReturnsTrue() {
        // Given
        Source source = createSource(defaultSeed());

        // When & Then
        assertThat(source.has("alpha")).isTrue();
        assertThat(source.has("beta")).isTrue();
    }

    @Test
    void has_KeyWithNullValue_ReturnsTrue() {
        // Given
        Source source = createSource(defaultSeed());

        // When & Then
        assertThat(source.has("gamma")).isTrue();
        assertThat(source.get("gamma")).isNull();
    }

    @Test
    void has_AbsentKey_ReturnsFalse() {
        // Given
        Source source = createSource(defaultSeed());

        // When & Then
        assertThat(source.has("delta")).isFalse();
    }

    @Test
    void get_SeededKey_ReturnsValue() {
        // Given
        Source source = createSource(defaultSeed());

        // When & Then
        assertThat(source.get("alpha")).isEqualTo(1);
        assertThat(source.get("beta")).isEqualTo("two");
    }

    @Test
    void get_AbsentKey_ReturnsNull() {
        // Given
        Source source = createSource(defaultSeed());

        // When & Then
        assertThat(source.get("delta")).isNull();
    }

    @Test
    void keys_ReportsEverySeededKeyAndAgreesWithHas() {
        // Given
        Source source = createSource(defaultSeed());

        // When
        List<String> keys = source.keys();

        // Then
        assertThat(keys).containsAll(defaultSeed().keySet());
        assertThat(keys).allMatch(source::has);
    }

    @Test
    void keys_EmptySource_ReturnsEmptyList() {
        // Given
        Source source = createSource(Map.of());

        // When & Then
        assertThat(source.keys()).isNotNull().isEmpty();
    }

    @Test
    void keys_MutatingResult_DoesNotAffectSource() {
        // Given
        Source source = createSource(defaultSeed());

        // When
        List<String> keys = source.keys();
        try {
            keys.clear();
        } catch (UnsupportedOperationException e) {
            // immutable snapshot is also acceptable
        }

        // Then
        assertThat(source.keys()).containsAll(defaultSeed().keySet());
    }

    @Test
    void delete_PresentKey_RemovesItAndReturnsTrue() {
        // Given
        Source source = createSource(defaultSeed());

        // When
        boolean deleted = source.delete("alpha");

        // Then
        assertThat(deleted).isTrue();
        assertThat(source.has("alpha")).isFalse();
        assertThat(source.keys()).doesNotContain("alpha");
        assertThat(source.has("beta")).isTrue();
    }

    @Test
    void delete_AbsentKey_ReturnsFalse() {
        // Given
        Source source = createSource(defaultSeed());

        // When & Then
        assertThat(source.delete("delta")).isFalse();
        assertThat(source.keys()).containsAll(defaultSeed().keySet());
    }

    @Test
    void nullKey_IsRejected() {
        // Given
        Source source = createSource(defaultSeed());

        // When & Then
        assertThatThrownBy(() -> source.has(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.get(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.delete(null)).isInstanceOf(IllegalArgumentException.class);
    }
}

package com.ryuqq.delegation.core.spi;

import java.util.List;

/**
 * Source SPI: a backing object whose properties a Composite delegates to.
 *
 * <p>A Composite holds a non-owning reference to each Source in its ordered
 * source list. The same Source may be shared by several Composites, and its
 * lifetime is independent of any of them.</p>
 *
 * <p><strong>Required Capabilities:</strong></p>
 * <ul>
 *   <li>Existence check: {@link #has(String)}</li>
 *   <li>Read: {@link #get(String)}</li>
 *   <li>Enumeration of own keys: {@link #keys()}</li>
 *   <li>Deletion: {@link #delete(String)}</li>
 * </ul>
 *
 * <p>Write is deliberately absent. A Composite never writes through to a
 * Source; values written via a Composite land in the Composite's own storage.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@code has(key)} and {@code keys()} must agree: a key reported by
 *       {@code has} is present in {@code keys()} and vice versa</li>
 *   <li>{@code get(key)} for an absent key returns {@code null}</li>
 *   <li>{@code keys()} may contain the same name more than once (a Composite
 *       used as a Source reports one entry per occurrence in its hierarchy)</li>
 *   <li>Thread safety is not required; callers serialize external access</li>
 * </ul>
 *
 * <p><strong>Implementation Example:</strong></p>
 * <pre>
 * // In-memory implementation (reference)
 * public class MapSource implements Source {
 *     private final Map&lt;String, Object&gt; values = new LinkedHashMap&lt;&gt;();
 *
 *     {@literal @}Override
 *     public boolean has(String key) {
 *         return values.containsKey(key);
 *     }
 *     ...
 * }
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public interface Source {

    /**
     * Checks whether this source exposes a property with the given name.
     *
     * @param key the property name
     * @return true if the property is present
     * @throws IllegalArgumentException if key is null
     */
    boolean has(String key);

    /**
     * Reads a property value.
     *
     * @param key the property name
     * @return the property value, or {@code null} if absent
     * @throws IllegalArgumentException if key is null
     */
    Object get(String key);

    /**
     * Enumerates the names of the properties this source exposes.
     *
     * <p>The returned list is a snapshot; mutating it does not affect the source.</p>
     *
     * @return property names in the source's own order (may contain repeats, never null)
     */
    List<String> keys();

    /**
     * Deletes a property.
     *
     * @param key the property name
     * @return true if something was deleted, false if the property was absent
     * @throws IllegalArgumentException if key is null
     */
    boolean delete(String key);
}

package com.ryuqq.delegation.adapter.inmemory.source;

import com.ryuqq.delegation.core.spi.Source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link Source} SPI for testing and reference purposes.
 *
 * <p>Properties live in a {@link LinkedHashMap}, so {@link #keys()} reports them in
 * insertion order. {@code null} values are allowed and count as present.</p>
 *
 * <p><strong>Operations:</strong></p>
 * <ul>
 *   <li><strong>has / get / delete:</strong> O(1) map access</li>
 *   <li><strong>keys:</strong> O(N) snapshot copy</li>
 *   <li><strong>put:</strong> seeding and mutation by the owner (not part of the SPI)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe</li>
 *   <li>Identity-based: two MapSources with equal content are still different sources</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MapSource engine = MapSource.of(Map.of("horsePower", 300));
 * MapSource wheels = new MapSource().put("count", 4);
 *
 * Composite car = new Composite(List.of(engine, wheels));
 * car.get("count"); // 4
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class MapSource implements Source {

    private final Map<String, Object> values;

    /**
     * Creates an empty source.
     */
    public MapSource() {
        this.values = new LinkedHashMap<>();
    }

    /**
     * Creates a source seeded with a copy of the given entries.
     *
     * @param initial initial entries (copied; later changes to the argument are not seen)
     * @return a new MapSource
     * @throws IllegalArgumentException if initial is null or contains a null key
     */
    public static MapSource of(Map<String, ?> initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        MapSource source = new MapSource();
        initial.forEach(source::put);
        return source;
    }

    /**
     * Puts a property.
     *
     * @param key the property name
     * @param value the value (null allowed)
     * @return this source, for chaining
     * @throws IllegalArgumentException if key is null
     */
    public MapSource put(String key, Object value) {
        requireKey(key);
        values.put(key, value);
        return this;
    }

    @Override
    public boolean has(String key) {
        requireKey(key);
        return values.containsKey(key);
    }

    @Override
    public Object get(String key) {
        requireKey(key);
        return values.get(key);
    }

    @Override
    public List<String> keys() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        if (!values.containsKey(key)) {
            return false;
        }
        values.remove(key);
        return true;
    }

    /**
     * Read-only view of the current entries.
     *
     * @return unmodifiable copy in insertion order
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @return number of properties
     */
    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "MapSource" + values.keySet();
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}

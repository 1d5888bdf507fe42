package com.ryuqq.delegation.testkit.contract;

import com.ryuqq.delegation.core.spi.Source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference {@link Source} that records every SPI call it receives.
 *
 * <p>Used by contract and scenario tests to verify scan order, short-circuiting
 * and fan-out behavior of a Composite without a mocking framework.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RecordingSource a = new RecordingSource("A").put("foo", 1);
 * RecordingSource b = new RecordingSource("B").put("foo", 2);
 * Composite composite = new Composite(List.of(a, b));
 *
 * composite.has("foo");
 * assertThat(b.calls()).isEmpty(); // has() stopped at A
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class RecordingSource implements Source {

    private final String name;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<Call> calls = new ArrayList<>();

    /**
     * Creates an empty recording source.
     *
     * @param name label used in {@link #toString()} and assertion messages
     */
    public RecordingSource(String name) {
        this.name = name;
    }

    /**
     * Seeds a property without recording a call.
     *
     * @param key the property name
     * @param value the value
     * @return this source
     */
    public RecordingSource put(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        values.put(key, value);
        return this;
    }

    @Override
    public boolean has(String key) {
        record("has", key);
        return values.containsKey(key);
    }

    @Override
    public Object get(String key) {
        record("get", key);
        return values.get(key);
    }

    @Override
    public List<String> keys() {
        record("keys", null);
        return new ArrayList<>(values.keySet());
    }

    @Override
    public boolean delete(String key) {
        record("delete", key);
        if (!values.containsKey(key)) {
            return false;
        }
        values.remove(key);
        return true;
    }

    /**
     * @return recorded calls in order (unmodifiable)
     */
    public List<Call> calls() {
        return Collections.unmodifiableList(calls);
    }

    /**
     * Counts recorded calls of one SPI method.
     *
     * @param operation "has", "get", "keys" or "delete"
     * @return number of calls
     */
    public long callCount(String operation) {
        return calls.stream().filter(call -> call.operation().equals(operation)).count();
    }

    /**
     * Forgets recorded calls; stored values are kept.
     */
    public void clearCalls() {
        calls.clear();
    }

    /**
     * @return whether the property is stored, without recording a call
     */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    @Override
    public String toString() {
        return "RecordingSource{" + name + '}';
    }

    private void record(String operation, String key) {
        if (key == null && !"keys".equals(operation)) {
            throw new IllegalArgumentException("key cannot be null");
        }
        calls.add(new Call(operation, key));
    }

    /**
     * One recorded SPI call.
     *
     * @param operation SPI method name
     * @param key property name (null for keys())
     */
    public record Call(String operation, String key) {}
}

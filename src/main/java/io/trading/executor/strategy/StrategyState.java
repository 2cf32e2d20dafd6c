package io.trading.executor.strategy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named values a strategy keeps between triggers.
 *
 * Each execution works on a copy that is committed back only when the execution completes,
 * so an abandoned or failed run leaves the previous values in place. Values should be
 * immutable; the copy is shallow.
 */
public class StrategyState {

    private final Map<String, Object> values;

    public StrategyState() {
        this.values = new HashMap<>();
    }

    private StrategyState(Map<String, Object> values) {
        this.values = new HashMap<>(values);
    }

    public void put(String name, Object value) {
        values.put(name, value);
    }

    /**
     * @throws ClassCastException if the stored value is not a {@code type}
     */
    public <T> Optional<T> get(String name, Class<T> type) {
        return Optional.ofNullable(type.cast(values.get(name)));
    }

    public <T> T getOrDefault(String name, Class<T> type, T defaultValue) {
        return get(name, type).orElse(defaultValue);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object remove(String name) {
        return values.remove(name);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    StrategyState copy() {
        return new StrategyState(values);
    }

    void replaceWith(StrategyState other) {
        values.clear();
        values.putAll(other.values);
    }
}

package com.github.yoep.fetcher.adapter;

import lombok.ToString;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Scratch space owned by a single worker for the whole of its lifetime.
 * Providers use it to reuse state, such as a login token, between tasks executed on the same worker.
 * It is never shared between workers and is therefore not thread-safe.
 */
@ToString
public class WorkerContext {
    private final Map<String, Object> values = new HashMap<>();

    /**
     * Get the value stored under the given key.
     *
     * @param key  The key of the value.
     * @param type The expected type of the value.
     * @param <T>  The value type.
     * @return Returns the value if present and of the expected type, else {@link Optional#empty()}.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        return Optional.ofNullable(values.get(key))
                .filter(type::isInstance)
                .map(type::cast);
    }

    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        values.put(key, value);
    }

    /**
     * Get the value stored under the given key, or store the supplied value when absent.
     *
     * @param key      The key of the value.
     * @param type     The expected type of the value.
     * @param supplier The supplier of the value when it's absent.
     * @param <T>      The value type.
     * @return Returns the stored value.
     */
    public <T> T computeIfAbsent(String key, Class<T> type, Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        return get(key, type).orElseGet(() -> {
            var value = supplier.get();
            put(key, value);
            return value;
        });
    }

    public void remove(String key) {
        values.remove(key);
    }

    public int size() {
        return values.size();
    }
}

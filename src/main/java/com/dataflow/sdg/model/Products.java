package com.dataflow.sdg.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable collection of type-tagged products used to assemble the contents of
 * a {@link ProductStore}.
 *
 * <p>
 * <b>Not thread-safe.</b> A {@code Products} instance is filled by a single
 * writer and then handed to a store factory method, which copies it into the
 * store's immutable product map. Modifying the instance afterwards has no
 * effect on the store.
 */
public final class Products {

    /** A stored value together with the type it was declared with. */
    public record Product(Class<?> type, Object value) {
        public Product {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(value, "value");
        }
    }

    private final Map<String, Product> entries = new LinkedHashMap<>();

    public static Products of(String key, Object value) {
        return new Products().add(key, value);
    }

    public static Products of(String k1, Object v1, String k2, Object v2) {
        return new Products().add(k1, v1).add(k2, v2);
    }

    /** Adds a product whose declared type is the runtime class of the value. */
    public Products add(String key, Object value) {
        Objects.requireNonNull(value, () -> "Product '" + key + "' must not be null");
        return put(key, new Product(value.getClass(), value));
    }

    /** Adds a product with an explicitly declared type. */
    public <T> Products add(String key, Class<T> type, T value) {
        return put(key, new Product(type, type.cast(value)));
    }

    Products put(String key, Product product) {
        Objects.requireNonNull(key, "key");
        if (entries.putIfAbsent(key, product) != null)
            throw new IllegalArgumentException("Product '" + key + "' already exists");
        return this;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    Map<String, Product> entries() {
        return entries;
    }

    Map<String, Product> freeze() {
        if (entries.isEmpty())
            return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}

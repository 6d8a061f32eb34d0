package com.dataflow.sdg.model;

import java.util.Objects;

/**
 * Typed read view of a product, remembering the scope it was read from.
 *
 * <p>
 * The level id is used to report provenance when a downstream computation
 * fails. Handles compare by the <em>identity</em> of the referenced value: two
 * handles are equal only if they point at the same object read from the same
 * scope, so a handle to a replaced value is never mistaken for the original.
 *
 * @param <T> the product type
 */
public final class Handle<T> {
    private final T value;
    private final LevelId id;

    public Handle(T value, LevelId id) {
        this.value = Objects.requireNonNull(value, "value");
        this.id = Objects.requireNonNull(id, "id");
    }

    public T get() {
        return value;
    }

    public LevelId id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Handle<?> other && value == other.value && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(value) + id.hashCode();
    }

    @Override
    public String toString() {
        return "Handle{" + value + " @ " + id + "}";
    }
}

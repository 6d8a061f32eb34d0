package com.dataflow.sdg.persistence;

import java.util.Objects;

/**
 * One product handed to the form layer: its label, the id of the scope it
 * belongs to, the value and the type it is stored as.
 */
public record FormProduct(String label, String id, Object data, Class<?> type) {

    public FormProduct {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(type, "type");
    }

    public static FormProduct of(String label, String id, Object data) {
        return new FormProduct(label, id, data, data.getClass());
    }
}

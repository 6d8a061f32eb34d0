package com.dataflow.sdg.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Data;

/**
 * Which products are persisted, and where.
 *
 * <p>
 * Loaded from JSON of the form
 * {@code {"items": [{"productName": "sum", "fileName": "out.mem", "technology": "IN_MEMORY"}]}}
 * or filled programmatically with {@link #addItem}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class OutputItemConfig {
    private List<PersistenceItem> items = new ArrayList<>();

    public OutputItemConfig addItem(String productName, String fileName, Technology technology) {
        items.add(new PersistenceItem(productName, fileName, technology));
        return this;
    }

    /** First item configured for the product. */
    public Optional<PersistenceItem> findItem(String productName) {
        for (PersistenceItem item : items) {
            if (item.getProductName().equals(productName))
                return Optional.of(item);
        }
        return Optional.empty();
    }
}

package com.dataflow.sdg.persistence;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Framework-facing entry into persistence.
 *
 * <p>
 * Only products named in the {@link OutputItemConfig} can be written or read.
 * Types are identified by their class name. Writes are serialized so that the
 * staging and commit of one batch are never interleaved with another.
 */
@Log4j2
public final class FormInterface {
    private final Persistence persistence;
    private final Map<String, PersistenceItem> productToConfig = new HashMap<>();

    public FormInterface(Persistence persistence, OutputItemConfig items, TechSettingConfig settings) {
        this.persistence = persistence;
        for (PersistenceItem item : items.getItems())
            productToConfig.putIfAbsent(item.getProductName(), item);
        persistence.configureOutputItems(items);
        persistence.configureTechSettings(settings);
        log.debug("Form layer configured for products {}", productToConfig.keySet());
    }

    /** In-memory form layer. */
    public static FormInterface inMemory(OutputItemConfig items) {
        return new FormInterface(new InMemoryPersistence(), items, new TechSettingConfig());
    }

    public boolean isConfigured(String productName) {
        return productToConfig.containsKey(productName);
    }

    public Persistence persistence() {
        return persistence;
    }

    /**
     * Writes and commits a single product.
     *
     * @throws UnconfiguredProductException if the product has no configuration
     */
    public synchronized void write(String creator, FormProduct product) {
        checkConfigured(product.label());
        String type = product.type().getName();
        persistence.createContainers(creator, Map.of(product.label(), type));
        persistence.registerWrite(creator, product.label(), product.data(), type);
        persistence.commitOutput(creator, product.id());
    }

    /**
     * Writes products of one scope with a single commit.
     *
     * @throws UnconfiguredProductException if any product has no configuration
     * @throws IllegalArgumentException     if the products have different ids
     */
    public synchronized void write(String creator, List<FormProduct> batch) {
        if (batch.isEmpty())
            return;
        String id = batch.get(0).id();
        Map<String, String> products = new LinkedHashMap<>();
        for (FormProduct product : batch) {
            checkConfigured(product.label());
            if (!product.id().equals(id))
                throw new IllegalArgumentException("Batch mixes ids " + id + " and " + product.id());
            products.put(product.label(), product.type().getName());
        }
        persistence.createContainers(creator, products);
        for (FormProduct product : batch)
            persistence.registerWrite(creator, product.label(), product.data(), product.type().getName());
        persistence.commitOutput(creator, id);
    }

    /**
     * Reads a committed product.
     *
     * @throws UnconfiguredProductException if the product has no configuration
     */
    public <T> T read(String creator, String label, String id, Class<T> type) {
        checkConfigured(label);
        return type.cast(persistence.read(creator, label, id, type.getName()));
    }

    private void checkConfigured(String label) {
        if (!productToConfig.containsKey(label))
            throw new UnconfiguredProductException(label);
    }
}

package com.dataflow.sdg.persistence;

import java.util.Map;

/**
 * Storage back end behind the {@link FormInterface}.
 *
 * <p>
 * Writes are two-phase: {@link #registerWrite} stages a value for a creator,
 * {@link #commitOutput} stores every staged value of that creator under one
 * product id. Containers are named {@code <creator>/<label>} and belong to
 * the file their product is configured for.
 */
public interface Persistence {

    void configureOutputItems(OutputItemConfig items);

    void configureTechSettings(TechSettingConfig settings);

    /**
     * Makes sure a container exists for each label.
     *
     * @param products label to type name
     */
    void createContainers(String creator, Map<String, String> products);

    void registerWrite(String creator, String label, Object data, String type);

    void commitOutput(String creator, String id);

    /** Reads a committed value. */
    Object read(String creator, String label, String id, String type);
}

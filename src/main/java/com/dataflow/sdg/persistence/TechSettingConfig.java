package com.dataflow.sdg.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;

/**
 * Technology-specific key/value settings for files and containers, e.g. a
 * compression level for one output file.
 *
 * <p>
 * Settings are kept in insertion order per technology and file (or
 * container) name.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TechSettingConfig {
    private Map<Technology, Map<String, Map<String, String>>> fileSettings = new EnumMap<>(Technology.class);
    private Map<Technology, Map<String, Map<String, String>>> containerSettings = new EnumMap<>(Technology.class);

    public TechSettingConfig addFileSetting(Technology technology, String fileName, String key, String value) {
        put(fileSettings, technology, fileName, key, value);
        return this;
    }

    public TechSettingConfig addContainerSetting(Technology technology, String containerName, String key,
            String value) {
        put(containerSettings, technology, containerName, key, value);
        return this;
    }

    /** Settings of one file; empty if none were configured. */
    public Map<String, String> fileSettings(Technology technology, String fileName) {
        return lookup(fileSettings, technology, fileName);
    }

    public Map<String, String> containerSettings(Technology technology, String containerName) {
        return lookup(containerSettings, technology, containerName);
    }

    private static void put(Map<Technology, Map<String, Map<String, String>>> table, Technology technology,
            String name, String key, String value) {
        table.computeIfAbsent(technology, k -> new LinkedHashMap<>())
                .computeIfAbsent(name, k -> new LinkedHashMap<>())
                .put(key, value);
    }

    private static Map<String, String> lookup(Map<Technology, Map<String, Map<String, String>>> table,
            Technology technology, String name) {
        Map<String, Map<String, String>> byName = table.get(technology);
        if (byName == null)
            return Map.of();
        Map<String, String> settings = byName.get(name);
        return settings == null ? Map.of() : Map.copyOf(settings);
    }
}

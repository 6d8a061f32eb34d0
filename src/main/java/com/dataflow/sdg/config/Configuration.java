package com.dataflow.sdg.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the configuration handed to a module or a source.
 *
 * <p>
 * Backed by a Jackson object tree. Required lookups throw
 * {@link IllegalArgumentException} naming the key when the key is missing or
 * holds a value of the wrong type; lookups with a default never throw for a
 * missing key.
 */
public final class Configuration {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Configuration EMPTY = new Configuration(JsonNodeFactory.instance.objectNode());

    private final ObjectNode root;

    private Configuration(ObjectNode root) {
        this.root = root;
    }

    public static Configuration empty() {
        return EMPTY;
    }

    /** Builds a configuration from plain Java values (maps, lists, scalars). */
    public static Configuration of(Map<String, ?> values) {
        return new Configuration(MAPPER.valueToTree(values));
    }

    public static Configuration fromJson(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid configuration JSON: " + e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode object))
            throw new IllegalArgumentException("Configuration JSON must be an object");
        return new Configuration(object);
    }

    public boolean has(String key) {
        JsonNode node = root.get(key);
        return node != null && !node.isNull();
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (Iterator<String> it = root.fieldNames(); it.hasNext();)
            keys.add(it.next());
        return keys;
    }

    public String getString(String key) {
        JsonNode node = required(key);
        if (!node.isTextual())
            throw wrongType(key, "a string", node);
        return node.textValue();
    }

    public String getString(String key, String defaultValue) {
        return has(key) ? getString(key) : defaultValue;
    }

    public int getInt(String key) {
        JsonNode node = required(key);
        if (!node.canConvertToInt() || !node.isIntegralNumber())
            throw wrongType(key, "an int", node);
        return node.intValue();
    }

    public int getInt(String key, int defaultValue) {
        return has(key) ? getInt(key) : defaultValue;
    }

    public long getLong(String key) {
        JsonNode node = required(key);
        if (!node.canConvertToLong() || !node.isIntegralNumber())
            throw wrongType(key, "a long", node);
        return node.longValue();
    }

    public long getLong(String key, long defaultValue) {
        return has(key) ? getLong(key) : defaultValue;
    }

    public double getDouble(String key) {
        JsonNode node = required(key);
        if (!node.isNumber())
            throw wrongType(key, "a number", node);
        return node.doubleValue();
    }

    public double getDouble(String key, double defaultValue) {
        return has(key) ? getDouble(key) : defaultValue;
    }

    public boolean getBoolean(String key) {
        JsonNode node = required(key);
        if (!node.isBoolean())
            throw wrongType(key, "a boolean", node);
        return node.booleanValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return has(key) ? getBoolean(key) : defaultValue;
    }

    /** Nested configuration table stored under {@code key}. */
    public Configuration getConfiguration(String key) {
        JsonNode node = required(key);
        if (!(node instanceof ObjectNode object))
            throw wrongType(key, "a table", node);
        return new Configuration(object);
    }

    /** List of strings stored under {@code key}. */
    public List<String> getStrings(String key) {
        JsonNode node = required(key);
        if (!node.isArray())
            throw wrongType(key, "a list", node);
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual())
                throw wrongType(key, "a list of strings", node);
            values.add(element.textValue());
        }
        return values;
    }

    private JsonNode required(String key) {
        if (!has(key))
            throw new IllegalArgumentException("Missing configuration key '" + key + "'");
        return root.get(key);
    }

    private static IllegalArgumentException wrongType(String key, String expected, JsonNode actual) {
        return new IllegalArgumentException("Configuration key '" + key + "' must be " + expected + ", got "
                + actual.getNodeType().name().toLowerCase() + " " + actual);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}

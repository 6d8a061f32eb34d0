package com.dataflow.sdg.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies an algorithm within a plugin.
 *
 * <p>
 * A name is parsed from a specification string of the form
 * {@code "plugin:algorithm"} or just {@code "algorithm"}. The name remembers
 * which of its fields were explicitly given so that a partially specified name
 * can be matched against fully specified ones:
 * <ul>
 * <li>{@link SpecifiedFields#NEITHER}: nothing given, matches every name.</li>
 * <li>{@link SpecifiedFields#EITHER}: only the algorithm was given.</li>
 * <li>{@link SpecifiedFields#BOTH}: plugin and algorithm were given.</li>
 * </ul>
 *
 * <p>
 * Equality and ordering only consider {@code (plugin, algorithm)}, so instances
 * can be used as keys of sorted maps.
 */
public final class AlgorithmName implements Comparable<AlgorithmName> {
    public static final char SEPARATOR = ':';

    private static final Comparator<AlgorithmName> ORDER = Comparator
            .comparing(AlgorithmName::plugin)
            .thenComparing(AlgorithmName::algorithm);

    private static final AlgorithmName UNSPECIFIED = new AlgorithmName("", "", SpecifiedFields.NEITHER);

    /** Which fields of the name were explicitly provided. */
    public enum SpecifiedFields {
        NEITHER, EITHER, BOTH
    }

    private final String plugin;
    private final String algorithm;
    private final SpecifiedFields fields;

    public AlgorithmName(String plugin, String algorithm) {
        this(plugin, algorithm, SpecifiedFields.BOTH);
    }

    public AlgorithmName(String plugin, String algorithm, SpecifiedFields fields) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.fields = Objects.requireNonNull(fields, "fields");
    }

    /** Returns the name that matches every other name. */
    public static AlgorithmName unspecified() {
        return UNSPECIFIED;
    }

    /**
     * Parses a name specification.
     *
     * @param spec {@code "plugin:algorithm"} or {@code "algorithm"}
     * @return the parsed name
     * @throws NameParseException if the specification is empty, contains more than
     *                            one separator, or has an empty part
     */
    public static AlgorithmName create(String spec) {
        if (spec == null || spec.isEmpty())
            throw new NameParseException("Cannot create an algorithm name from an empty string.");

        int pos = spec.indexOf(SEPARATOR);
        if (pos < 0)
            return new AlgorithmName("", spec, SpecifiedFields.EITHER);

        if (spec.indexOf(SEPARATOR, pos + 1) >= 0)
            throw new NameParseException("The algorithm name '" + spec + "' has more than one '"
                    + SEPARATOR + "' separator.");

        String plugin = spec.substring(0, pos);
        String algorithm = spec.substring(pos + 1);
        if (plugin.isEmpty() || algorithm.isEmpty())
            throw new NameParseException("The algorithm name '" + spec + "' has an empty plugin or algorithm part.");
        return new AlgorithmName(plugin, algorithm, SpecifiedFields.BOTH);
    }

    public String plugin() {
        return plugin;
    }

    public String algorithm() {
        return algorithm;
    }

    public SpecifiedFields fields() {
        return fields;
    }

    public boolean hasPlugin() {
        return fields == SpecifiedFields.BOTH;
    }

    public boolean hasAlgorithm() {
        return fields != SpecifiedFields.NEITHER;
    }

    public boolean isEmpty() {
        return plugin.isEmpty() && algorithm.isEmpty();
    }

    /** Canonical form: {@code plugin:algorithm}, or {@code algorithm} without a plugin. */
    public String full() {
        if (plugin.isEmpty())
            return algorithm;
        return plugin + SEPARATOR + algorithm;
    }

    /**
     * Two names match if every field given in both names is equal. A field that
     * is unset in either name acts as a wildcard.
     */
    public boolean match(AlgorithmName other) {
        if (hasAlgorithm() && other.hasAlgorithm() && !algorithm.equals(other.algorithm))
            return false;
        return !(hasPlugin() && other.hasPlugin() && !plugin.equals(other.plugin));
    }

    @Override
    public int compareTo(AlgorithmName other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlgorithmName other))
            return false;
        return plugin.equals(other.plugin) && algorithm.equals(other.algorithm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(plugin, algorithm);
    }

    @Override
    public String toString() {
        return full();
    }
}

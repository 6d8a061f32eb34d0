package com.dataflow.sdg.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * An algorithm qualifier plus the bare label of a data product.
 *
 * <p>
 * Rendered as {@code plugin:algorithm/name}. When the qualifier is empty the
 * full form is just the bare name.
 */
public final class QualifiedName implements Comparable<QualifiedName> {
    public static final char SEPARATOR = '/';

    private static final Comparator<QualifiedName> ORDER = Comparator
            .comparing(QualifiedName::qualifier)
            .thenComparing(QualifiedName::name);

    private final AlgorithmName qualifier;
    private final String name;

    public QualifiedName(String name) {
        this(AlgorithmName.unspecified(), name);
    }

    public QualifiedName(AlgorithmName qualifier, String name) {
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Parses {@code "plugin:algorithm/name"}, {@code "algorithm/name"} or
     * {@code "name"}.
     */
    public static QualifiedName create(String spec) {
        if (spec == null || spec.isEmpty())
            throw new NameParseException("Cannot create a qualified name from an empty string.");
        int pos = spec.lastIndexOf(SEPARATOR);
        if (pos < 0)
            return new QualifiedName(spec);
        String name = spec.substring(pos + 1);
        if (name.isEmpty())
            throw new NameParseException("The qualified name '" + spec + "' has an empty product name.");
        return new QualifiedName(AlgorithmName.create(spec.substring(0, pos)), name);
    }

    /** Qualifies each output label with the same producer. */
    public static List<QualifiedName> toQualifiedNames(AlgorithmName qualifier, List<String> labels) {
        List<QualifiedName> result = new ArrayList<>(labels.size());
        for (String label : labels)
            result.add(new QualifiedName(qualifier, label));
        return result;
    }

    public AlgorithmName qualifier() {
        return qualifier;
    }

    public String plugin() {
        return qualifier.plugin();
    }

    public String algorithm() {
        return qualifier.algorithm();
    }

    public String name() {
        return name;
    }

    public String full() {
        String q = qualifier.full();
        if (q.isEmpty())
            return name;
        return q + SEPARATOR + name;
    }

    @Override
    public int compareTo(QualifiedName other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QualifiedName other))
            return false;
        return qualifier.equals(other.qualifier) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, name);
    }

    @Override
    public String toString() {
        return full();
    }
}

package com.dataflow.sdg.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reference to an input data product.
 *
 * <p>
 * A label is a bare product name, optionally qualified by the algorithm that
 * produces it ({@code "adder/sum"}). The qualifier only disambiguates producers
 * of the same name; an unqualified label accepts any producer and is resolved
 * against the nearest store in scope that owns the name.
 */
public final class Label {
    private final QualifiedName name;

    private Label(QualifiedName name) {
        this.name = name;
    }

    public static Label create(String spec) {
        return new Label(QualifiedName.create(spec));
    }

    public static Label of(AlgorithmName producer, String name) {
        return new Label(new QualifiedName(producer, name));
    }

    public static List<Label> create(String... specs) {
        return Arrays.stream(specs).map(Label::create).toList();
    }

    /** The bare product name used for store lookup. */
    public String name() {
        return name.name();
    }

    public AlgorithmName producer() {
        return name.qualifier();
    }

    public boolean isQualified() {
        return name.qualifier().hasAlgorithm();
    }

    /** True if the given product could satisfy this label. */
    public boolean matches(QualifiedName product) {
        return name.name().equals(product.name()) && name.qualifier().match(product.qualifier());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof Label other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name.full();
    }
}

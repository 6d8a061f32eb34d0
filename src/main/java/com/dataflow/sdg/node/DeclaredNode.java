package com.dataflow.sdg.node;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.Node;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;

import java.util.List;
import java.util.Objects;

/**
 * Base class for the immutable node descriptors created by the registrar.
 *
 * <p>
 * Subclasses add the kind-specific algorithm. Nothing here is mutated after
 * construction; per-scope bookkeeping (join slots, fold accumulators) is kept
 * by the execution substrate.
 */
public abstract class DeclaredNode implements Node {
    private final AlgorithmName name;
    private final Concurrency concurrency;
    private final List<Label> inputs;
    private final List<QualifiedName> outputs;
    private final List<String> predicates;

    protected DeclaredNode(AlgorithmName name, Concurrency concurrency, List<Label> inputs,
            List<QualifiedName> outputs, List<String> predicates) {
        this.name = Objects.requireNonNull(name, "name");
        this.concurrency = Objects.requireNonNull(concurrency, "concurrency");
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.predicates = List.copyOf(predicates);
    }

    @Override
    public AlgorithmName name() {
        return name;
    }

    @Override
    public Concurrency concurrency() {
        return concurrency;
    }

    @Override
    public List<Label> inputs() {
        return inputs;
    }

    @Override
    public List<QualifiedName> outputs() {
        return outputs;
    }

    @Override
    public List<String> predicates() {
        return predicates;
    }

    @Override
    public String toString() {
        return kind() + "[" + fullName() + "]";
    }
}

package com.dataflow.sdg.node;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.FnN;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;

import java.util.List;

/**
 * A pure mapping from one input tuple to its output products.
 *
 * <p>
 * With a single output the algorithm result is the product. With several
 * outputs the algorithm must return a {@link List} holding one value per
 * output, in declaration order.
 */
public final class DeclaredTransform extends DeclaredNode {
    private final FnN<?> body;

    public DeclaredTransform(AlgorithmName name, Concurrency concurrency, List<Label> inputs,
            List<QualifiedName> outputs, List<String> predicates, FnN<?> body) {
        super(name, concurrency, inputs, outputs, predicates);
        if (outputs.isEmpty())
            throw new IllegalArgumentException("Transform " + name + " must create at least one product");
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRANSFORM;
    }

    /** Runs the algorithm and returns one value per output. */
    public List<?> invoke(Object[] args) {
        Object result = body.apply(args);
        int expected = outputs().size();
        if (expected == 1)
            return List.of(result);
        if (!(result instanceof List<?> values) || values.size() != expected)
            throw new IllegalStateException("Transform " + fullName() + " must return a List of " + expected
                    + " values, got " + result);
        return values;
    }
}

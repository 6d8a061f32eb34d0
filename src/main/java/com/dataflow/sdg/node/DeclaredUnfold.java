package com.dataflow.sdg.node;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.Unfold;
import com.dataflow.sdg.fn.UnfoldStep;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;

import java.util.List;
import java.util.function.Predicate;

/**
 * Generator of child scopes.
 *
 * <p>
 * The single input is the initial state. While {@code more} holds for the
 * current state, {@code step} produces the next state and one product, which
 * is published in a new child scope at the destination level.
 */
public final class DeclaredUnfold extends DeclaredNode {
    private final Predicate<Object> more;
    private final Unfold<Object, Object> step;
    private final String destinationLevel;

    public DeclaredUnfold(AlgorithmName name, Concurrency concurrency, List<Label> inputs,
            List<QualifiedName> outputs, List<String> predicates, Predicate<Object> more,
            Unfold<Object, Object> step, String destinationLevel) {
        super(name, concurrency, inputs, outputs, predicates);
        if (inputs.size() != 1)
            throw new IllegalArgumentException("Unfold " + name + " takes exactly one input, got " + inputs);
        if (outputs.size() != 1)
            throw new IllegalArgumentException("Unfold " + name + " must create exactly one product, got " + outputs);
        if (destinationLevel == null || destinationLevel.isEmpty())
            throw new IllegalArgumentException("Unfold " + name + " requires a destination level");
        this.more = more;
        this.step = step;
        this.destinationLevel = destinationLevel;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNFOLD;
    }

    public String destinationLevel() {
        return destinationLevel;
    }

    public boolean hasMore(Object state) {
        return more.test(state);
    }

    public UnfoldStep<Object, Object> next(Object state) {
        UnfoldStep<Object, Object> result = step.next(state);
        if (result == null || result.product() == null)
            throw new IllegalStateException("Unfold " + fullName() + " produced no child product");
        return result;
    }
}

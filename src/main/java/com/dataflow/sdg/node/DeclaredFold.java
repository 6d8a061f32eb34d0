package com.dataflow.sdg.node;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.FoldN;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;

import java.util.List;
import java.util.function.Supplier;

/**
 * Accumulation over all inputs that fall inside one partition instance.
 *
 * <p>
 * The partition is named by a level: every input is folded into the
 * accumulator of its nearest self-or-ancestor scope at that level. When that
 * scope is flushed the accumulator is emitted as the fold's single product.
 */
public final class DeclaredFold extends DeclaredNode {
    private final FoldN<Object> body;
    private final Supplier<?> initial;
    private final String partition;
    private final FoldPolicy policy;

    public DeclaredFold(AlgorithmName name, Concurrency concurrency, List<Label> inputs,
            List<QualifiedName> outputs, List<String> predicates, FoldN<Object> body, Supplier<?> initial,
            String partition, FoldPolicy policy) {
        super(name, concurrency, inputs, outputs, predicates);
        if (outputs.size() != 1)
            throw new IllegalArgumentException("Fold " + name + " must create exactly one product, got " + outputs);
        this.body = body;
        this.initial = initial;
        this.partition = partition;
        this.policy = policy;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOLD;
    }

    public String partition() {
        return partition;
    }

    public FoldPolicy policy() {
        return policy;
    }

    public Object initialValue() {
        Object value = initial.get();
        if (value == null)
            throw new IllegalStateException("Fold " + fullName() + " initial value must not be null");
        return value;
    }

    public Object fold(Object accumulator, Object[] args) {
        Object next = body.fold(accumulator, args);
        if (next == null)
            throw new IllegalStateException("Fold " + fullName() + " returned a null accumulator");
        return next;
    }
}

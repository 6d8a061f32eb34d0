package com.dataflow.sdg.node;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.FnN;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;

import java.util.List;

/** Boolean gate evaluated once per input tuple; creates no product. */
public final class DeclaredPredicate extends DeclaredNode {
    private final FnN<Boolean> body;

    public DeclaredPredicate(AlgorithmName name, Concurrency concurrency, List<Label> inputs,
            List<String> predicates, FnN<Boolean> body) {
        super(name, concurrency, inputs, List.of(), predicates);
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PREDICATE;
    }

    public boolean evaluate(Object[] args) {
        Boolean result = body.apply(args);
        if (result == null)
            throw new IllegalStateException("Predicate " + fullName() + " returned null");
        return result;
    }
}

package com.dataflow.sdg.node;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.ObserverN;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;

import java.util.List;

/** Side-effecting sink; creates no product. */
public final class DeclaredObserver extends DeclaredNode {
    private final ObserverN body;

    public DeclaredObserver(AlgorithmName name, Concurrency concurrency, List<Label> inputs,
            List<String> predicates, ObserverN body) {
        super(name, concurrency, inputs, List.of(), predicates);
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OBSERVE;
    }

    public void observe(Object[] args) {
        body.observe(args);
    }
}

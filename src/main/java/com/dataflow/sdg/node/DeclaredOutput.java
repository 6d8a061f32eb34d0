package com.dataflow.sdg.node;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.OutputFn;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.ProductStore;

import java.util.List;

/**
 * Terminal sink receiving whole stores rather than individual products.
 *
 * <p>
 * An output has no input labels: it sees every data store published in the
 * graph, optionally restricted to the scopes for which all of its predicates
 * were true.
 */
public final class DeclaredOutput extends DeclaredNode {
    private final OutputFn body;

    public DeclaredOutput(AlgorithmName name, Concurrency concurrency, List<String> predicates, OutputFn body) {
        super(name, concurrency, List.of(), List.of(), predicates);
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OUTPUT;
    }

    public void write(ProductStore store) {
        body.write(store);
    }
}

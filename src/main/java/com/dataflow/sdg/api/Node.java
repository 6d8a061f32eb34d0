package com.dataflow.sdg.api;

import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;

import java.util.List;

/**
 * Descriptor of a node in the computation graph.
 *
 * <p>
 * A node is created exactly once, at the end of its declaration statement,
 * and is owned by the node catalog afterwards. Descriptors are immutable: the
 * execution substrate reads them to wire the node, and only per-invocation
 * state lives outside the descriptor.
 */
public interface Node {

    /** Algorithm name, qualified by the plugin that declared it. */
    AlgorithmName name();

    /** Catalog key of this node. */
    default String fullName() {
        return name().full();
    }

    NodeKind kind();

    Concurrency concurrency();

    /** Input labels, in the order the algorithm expects its arguments. */
    List<Label> inputs();

    /** Products created by this node; empty for sinks and predicates. */
    List<QualifiedName> outputs();

    /** Names of the predicates that must all be true for this node to run. */
    List<String> predicates();
}

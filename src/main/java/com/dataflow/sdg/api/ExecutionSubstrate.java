package com.dataflow.sdg.api;

import com.dataflow.sdg.engine.NodeCatalog;
import com.dataflow.sdg.model.ProductStore;

import java.util.List;

/**
 * Runs the nodes of a catalog over the stores published into it.
 *
 * <p>
 * Lifecycle: {@link #bind(NodeCatalog)} once, then any number of
 * {@link #publish(ProductStore)} calls from the source thread ending with the
 * flush of the root scope, then {@link #awaitCompletion()} and
 * {@link #shutdown()}.
 */
public interface ExecutionSubstrate {

    /** Wires the nodes of a validated catalog. */
    void bind(NodeCatalog catalog);

    /** Publishes a source store or a flush signal. */
    void publish(ProductStore store);

    /** Blocks until the root scope was flushed and all resulting work is done. */
    void awaitCompletion() throws InterruptedException;

    /** Node invocations that failed so far. */
    List<NodeFailure> failures();

    void shutdown();
}

package com.dataflow.sdg.api;

import com.dataflow.sdg.model.ProductStore;

/**
 * Handed to a source to advance the root of the hierarchy.
 *
 * <p>
 * Sources create stores (typically {@link ProductStore#base()} and its
 * children) and yield them in depth-first order. The driver closes scopes on
 * its own: yielding a store that is not inside the most recently opened scope
 * flushes the scopes that were left.
 */
public interface FrameworkDriver {

    /** Publishes a newly created scope into the graph. */
    void yield(ProductStore store);
}

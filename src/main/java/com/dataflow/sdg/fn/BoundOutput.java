package com.dataflow.sdg.fn;

import com.dataflow.sdg.model.ProductStore;

/** Output sink invoked on a bound receiver. */
@FunctionalInterface
public interface BoundOutput<S> {
    void write(S self, ProductStore store);
}

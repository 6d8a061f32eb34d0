package com.dataflow.sdg.fn;

import com.dataflow.sdg.model.ProductStore;

/** Terminal sink receiving every published data store. */
@FunctionalInterface
public interface OutputFn {
    void write(ProductStore store);
}

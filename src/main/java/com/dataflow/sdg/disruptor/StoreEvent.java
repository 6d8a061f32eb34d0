package com.dataflow.sdg.disruptor;

import com.dataflow.sdg.model.ProductStore;

/**
 * Mutable slot of the source ring buffer.
 *
 * <p>
 * <b>Flyweight:</b> instances are pre-allocated when the ring buffer is built
 * and reused for the lifetime of the run. The source thread fills a slot with
 * {@link #set(ProductStore, long)}; the publisher thread clears it once the
 * store has been handed to the substrate so the store can be collected.
 */
public final class StoreEvent {
    private ProductStore store;
    private long sequenceId;

    public void set(ProductStore store, long sequenceId) {
        this.store = store;
        this.sequenceId = sequenceId;
    }

    public ProductStore store() {
        return store;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        store = null;
        sequenceId = 0;
    }
}

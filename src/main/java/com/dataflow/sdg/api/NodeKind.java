package com.dataflow.sdg.api;

/** The kinds of algorithm a graph node can wrap. */
public enum NodeKind {
    TRANSFORM,
    FOLD,
    UNFOLD,
    PREDICATE,
    OBSERVE,
    OUTPUT;

    /** True for kinds that may create data products. */
    public boolean createsProducts() {
        return this == TRANSFORM || this == FOLD || this == UNFOLD;
    }
}

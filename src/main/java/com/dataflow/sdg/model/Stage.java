package com.dataflow.sdg.model;

/** Processing stage of a product store. */
public enum Stage {
    /** Store carries products to be processed. */
    PROCESS,
    /** Store carries no products and marks the end of its scope. */
    FLUSH
}

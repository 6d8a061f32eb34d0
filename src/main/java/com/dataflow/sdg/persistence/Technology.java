package com.dataflow.sdg.persistence;

/**
 * Storage technologies a persistence item can be routed to.
 *
 * <p>
 * Only {@link #IN_MEMORY} ships with the framework; the others name
 * technologies provided by external persistence implementations.
 */
public enum Technology {
    IN_MEMORY,
    ROOT_TTREE,
    ROOT_RNTUPLE,
    HDF5
}

package com.dataflow.sdg.persistence;

/**
 * A container was attached to a file of another technology, or a technology
 * was requested from a persistence implementation that does not provide it.
 */
public class TechnologyMismatchException extends RuntimeException {

    public TechnologyMismatchException(String message) {
        super(message);
    }
}

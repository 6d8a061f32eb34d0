package com.dataflow.sdg.model;

/**
 * Thrown when an algorithm or product name specification cannot be parsed.
 */
public class NameParseException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public NameParseException(String message) {
        super(message);
    }
}

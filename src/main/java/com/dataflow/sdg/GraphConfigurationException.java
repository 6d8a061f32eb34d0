package com.dataflow.sdg;

import java.util.List;

/**
 * Aggregate build failure: every problem collected while the module entry
 * points declared their algorithms.
 */
public class GraphConfigurationException extends RuntimeException {
    private final List<String> errors;

    public GraphConfigurationException(List<String> errors) {
        super(message(errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }

    private static String message(List<String> errors) {
        StringBuilder sb = new StringBuilder("Graph configuration has ").append(errors.size())
                .append(errors.size() == 1 ? " error:" : " errors:");
        for (String error : errors)
            sb.append("\n  - ").append(error);
        return sb.toString();
    }
}

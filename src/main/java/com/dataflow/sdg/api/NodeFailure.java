package com.dataflow.sdg.api;

import com.dataflow.sdg.model.LevelId;

/**
 * A node invocation that threw.
 *
 * @param nodeName full name of the failing node
 * @param id       scope the invocation ran for
 * @param error    the exception thrown by the node body or its bookkeeping
 */
public record NodeFailure(String nodeName, LevelId id, Throwable error) {
    @Override
    public String toString() {
        return nodeName + " @ " + id + ": " + error;
    }
}

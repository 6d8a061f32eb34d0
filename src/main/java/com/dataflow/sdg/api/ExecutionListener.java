package com.dataflow.sdg.api;

import com.dataflow.sdg.model.LevelId;

/**
 * Observability hook for node invocations.
 *
 * <p>
 * Callbacks run on the worker thread that executed the node, concurrently
 * with other invocations. Implementations must be thread-safe and cheap: any
 * blocking here slows down the whole graph.
 */
public interface ExecutionListener {

    /**
     * Called after a node body returned normally.
     *
     * @param nodeName      full name of the node
     * @param id            scope the node ran for
     * @param durationNanos wall time spent in the node body
     */
    void onNodeExecuted(String nodeName, LevelId id, long durationNanos);

    /**
     * Called when a node body threw.
     *
     * @param nodeName full name of the node
     * @param id       scope the node ran for
     * @param error    the exception
     */
    void onNodeError(String nodeName, LevelId id, Throwable error);
}

package com.dataflow.sdg.util;

import com.dataflow.sdg.api.ExecutionListener;
import com.dataflow.sdg.model.LevelId;

import java.util.Arrays;

/**
 * Fans node callbacks out to several {@link ExecutionListener}s.
 *
 * <p>
 * Listeners are registered during setup; the array is replaced on every
 * addition so iteration on worker threads needs no lock.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public synchronized void add(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onNodeExecuted(String nodeName, LevelId id, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onNodeExecuted(nodeName, id, durationNanos);
    }

    @Override
    public void onNodeError(String nodeName, LevelId id, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onNodeError(nodeName, id, error);
    }
}

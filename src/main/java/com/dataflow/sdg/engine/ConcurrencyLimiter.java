package com.dataflow.sdg.engine;

import com.dataflow.sdg.api.Concurrency;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-blocking gate keeping at most {@code limit} tasks of one node running.
 *
 * <p>
 * Submitted tasks are queued; a task is handed to the executor only when a
 * permit is free, and finishing a task dispatches the next queued one. No
 * thread ever waits for a permit.
 */
final class ConcurrencyLimiter {
    private final Executor executor;
    private final int limit;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger running = new AtomicInteger();

    ConcurrencyLimiter(Executor executor, Concurrency concurrency) {
        this.executor = executor;
        this.limit = concurrency.value();
    }

    void submit(Runnable task) {
        queue.add(task);
        dispatch();
    }

    int running() {
        return running.get();
    }

    int queued() {
        return queue.size();
    }

    private void dispatch() {
        while (!queue.isEmpty()) {
            int current = running.get();
            if (current >= limit)
                return;
            if (!running.compareAndSet(current, current + 1))
                continue;
            Runnable task = queue.poll();
            if (task == null) {
                // Another dispatcher took it
                running.decrementAndGet();
                continue;
            }
            executor.execute(() -> {
                try {
                    task.run();
                } finally {
                    running.decrementAndGet();
                    dispatch();
                }
            });
        }
    }
}

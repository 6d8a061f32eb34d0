package com.dataflow.sdg.engine;

import com.dataflow.sdg.model.LevelId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-flight work accounting per scope.
 *
 * <p>
 * Every unit of work (routing a published store, a queued or running node
 * invocation) is entered against its scope id before it is scheduled and
 * exited when it is done. Entering counts the id and every ancestor, so the
 * count of a scope covers all work at or below it.
 *
 * <p>
 * A flush of a scope is held back with {@link #whenIdle(LevelId, Runnable)}
 * until that count drops to zero. The held flush itself is entered against
 * the scope's parent, so the parent cannot become idle before it.
 *
 * <p>
 * A single monitor guards the counters; actions are run outside of it.
 */
final class ScopeTracker {
    private final Map<LevelId, Integer> inFlight = new HashMap<>();
    private final Map<LevelId, List<Runnable>> parked = new HashMap<>();

    synchronized void enter(LevelId id) {
        for (LevelId p = id; p != null; p = p.parent())
            inFlight.merge(p, 1, Integer::sum);
    }

    void exit(LevelId id) {
        List<Runnable> released = null;
        synchronized (this) {
            for (LevelId p = id; p != null; p = p.parent()) {
                Integer current = inFlight.get(p);
                if (current == null)
                    throw new IllegalStateException("Unbalanced exit for scope " + p);
                if (current > 1) {
                    inFlight.put(p, current - 1);
                } else {
                    inFlight.remove(p);
                    List<Runnable> actions = parked.remove(p);
                    if (actions != null) {
                        if (released == null)
                            released = new ArrayList<>();
                        released.addAll(actions);
                    }
                }
            }
            if (inFlight.isEmpty())
                notifyAll();
        }
        if (released != null) {
            for (Runnable action : released)
                action.run();
        }
    }

    /** Runs {@code action} once no work is in flight at or below {@code id}. */
    void whenIdle(LevelId id, Runnable action) {
        synchronized (this) {
            if (inFlight.containsKey(id)) {
                parked.computeIfAbsent(id, k -> new ArrayList<>()).add(action);
                return;
            }
        }
        action.run();
    }

    synchronized int count(LevelId id) {
        return inFlight.getOrDefault(id, 0);
    }

    synchronized int parkedCount() {
        int n = 0;
        for (List<Runnable> actions : parked.values())
            n += actions.size();
        return n;
    }

    synchronized void awaitIdle() throws InterruptedException {
        while (!inFlight.isEmpty())
            wait();
    }
}

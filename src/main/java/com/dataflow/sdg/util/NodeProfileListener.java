package com.dataflow.sdg.util;

import com.dataflow.sdg.api.ExecutionListener;
import com.dataflow.sdg.model.LevelId;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Aggregates execution statistics per node to identify bottlenecks. */
public class NodeProfileListener implements ExecutionListener {

    public static class NodeStats {
        public final String name;
        private long count;
        private long errors;
        private long totalDurationNanos;
        private long minDurationNanos = Long.MAX_VALUE;
        private long maxDurationNanos = Long.MIN_VALUE;
        private long lastDurationNanos;

        public NodeStats(String name) {
            this.name = name;
        }

        synchronized void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void error() {
            errors++;
        }

        public synchronized long count() {
            return count;
        }

        public synchronized long errors() {
            return errors;
        }

        public synchronized long totalDurationNanos() {
            return totalDurationNanos;
        }

        public synchronized double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }

        synchronized NodeStats snapshot() {
            NodeStats copy = new NodeStats(name);
            copy.count = count;
            copy.errors = errors;
            copy.totalDurationNanos = totalDurationNanos;
            copy.minDurationNanos = minDurationNanos;
            copy.maxDurationNanos = maxDurationNanos;
            copy.lastDurationNanos = lastDurationNanos;
            return copy;
        }
    }

    private final ConcurrentMap<String, NodeStats> stats = new ConcurrentHashMap<>();

    @Override
    public void onNodeExecuted(String nodeName, LevelId id, long durationNanos) {
        stats.computeIfAbsent(nodeName, NodeStats::new).update(durationNanos);
    }

    @Override
    public void onNodeError(String nodeName, LevelId id, Throwable error) {
        stats.computeIfAbsent(nodeName, NodeStats::new).error();
    }

    /** Snapshot of the statistics of one node, or null if it never ran. */
    public NodeStats stats(String nodeName) {
        NodeStats s = stats.get(nodeName);
        return s == null ? null : s.snapshot();
    }

    /** Resets all collected statistics. */
    public void reset() {
        stats.clear();
    }

    /** Returns a table of node statistics, most expensive node first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %10s | %8s | %10s | %10s | %10s | %10s%n", "Node Name", "Count", "Errors",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("-".repeat(112)).append('\n');

        List<NodeStats> snapshot = new ArrayList<>();
        for (NodeStats s : stats.values())
            snapshot.add(s.snapshot());
        snapshot.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : snapshot) {
            boolean ran = s.count > 0;
            sb.append(String.format("%-30s | %10d | %8d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.name, 30),
                    s.count,
                    s.errors,
                    s.lastDurationNanos / 1000.0,
                    s.avgMicros(),
                    ran ? s.minDurationNanos / 1000.0 : 0.0,
                    ran ? s.maxDurationNanos / 1000.0 : 0.0));
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}

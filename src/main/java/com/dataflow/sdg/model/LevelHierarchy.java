package com.dataflow.sdg.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.log4j.Log4j2;

/**
 * Population counters for the levels of the run-time hierarchy.
 *
 * <p>
 * Every new scope instance is counted against its level position, which is
 * identified by the level name and the level-name path of its parent (so
 * {@code job/run/event} and {@code job/calibration/event} are distinct
 * entries). Entries are inserted lazily and never removed during a run.
 *
 * <p>
 * {@link #incrementCount(LevelId)} is the only operation on the execution
 * path; it is lock-free. Rendering is for reporting only.
 */
@Log4j2
public final class LevelHierarchy {

    private static final long NO_PARENT = -1L;

    private static final class LevelEntry {
        final String name;
        final long parentHash;
        final AtomicLong count = new AtomicLong();

        LevelEntry(String name, long parentHash) {
            this.name = name;
            this.parentHash = parentHash;
        }
    }

    private final ConcurrentHashMap<Long, LevelEntry> levels = new ConcurrentHashMap<>();

    /** Counts one new scope instance at the level position of {@code id}. */
    public void incrementCount(LevelId id) {
        LevelEntry entry = levels.get(id.levelHash());
        if (entry == null) {
            long parentHash = id.hasParent() ? id.parent().levelHash() : NO_PARENT;
            entry = levels.computeIfAbsent(id.levelHash(), k -> new LevelEntry(id.levelName(), parentHash));
        }
        entry.count.incrementAndGet();
    }

    /** Total count for a level name, summed over all parent contexts. */
    public long countFor(String levelName) {
        long total = 0;
        for (LevelEntry entry : levels.values()) {
            if (entry.name.equals(levelName))
                total += entry.count.get();
        }
        return total;
    }

    /** Logs the level tree at INFO. */
    public void print() {
        log.info("Processed levels:\n{}", graphLayout());
    }

    /** Indented tree of level names and their counts. */
    public String graphLayout() {
        Map<Long, List<Map.Entry<Long, LevelEntry>>> byParent = new TreeMap<>();
        for (Map.Entry<Long, LevelEntry> e : levels.entrySet())
            byParent.computeIfAbsent(e.getValue().parentHash, k -> new ArrayList<>()).add(e);
        for (List<Map.Entry<Long, LevelEntry>> children : byParent.values())
            children.sort(Comparator.comparing(e -> e.getValue().name));

        StringBuilder sb = new StringBuilder(256);
        List<Map.Entry<Long, LevelEntry>> roots = byParent.getOrDefault(NO_PARENT, List.of());
        if (roots.isEmpty()) {
            // Counting may have started below the root
            for (Map.Entry<Long, LevelEntry> e : levels.entrySet()) {
                if (!levels.containsKey(e.getValue().parentHash))
                    render(sb, byParent, e, "");
            }
        } else {
            for (Map.Entry<Long, LevelEntry> root : roots)
                render(sb, byParent, root, "");
        }
        return sb.toString();
    }

    private void render(StringBuilder sb, Map<Long, List<Map.Entry<Long, LevelEntry>>> byParent,
            Map.Entry<Long, LevelEntry> node, String indent) {
        LevelEntry entry = node.getValue();
        sb.append(indent).append(entry.name).append(": ").append(entry.count.get()).append('\n');
        for (Map.Entry<Long, LevelEntry> child : byParent.getOrDefault(node.getKey(), List.of()))
            render(sb, byParent, child, indent + "  ");
    }
}

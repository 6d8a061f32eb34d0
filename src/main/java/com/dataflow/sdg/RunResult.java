package com.dataflow.sdg;

import com.dataflow.sdg.api.NodeFailure;
import com.dataflow.sdg.model.LevelHierarchy;

import java.util.List;

import lombok.Getter;

/** Outcome of one run: node failures and the level populations. */
@Getter
public final class RunResult {
    private final List<NodeFailure> failures;
    private final LevelHierarchy hierarchy;
    private final long wallNanos;

    public RunResult(List<NodeFailure> failures, LevelHierarchy hierarchy, long wallNanos) {
        this.failures = List.copyOf(failures);
        this.hierarchy = hierarchy;
        this.wallNanos = wallNanos;
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    /** Number of scopes processed at the given level. */
    public long count(String levelName) {
        return hierarchy.countFor(levelName);
    }
}

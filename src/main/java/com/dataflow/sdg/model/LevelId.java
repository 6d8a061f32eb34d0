package com.dataflow.sdg.model;

import com.dataflow.sdg.util.Hashing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Position of a scope instance in the run-time hierarchy.
 *
 * <p>
 * A level id is an ordered path of {@code (levelNumber, levelName)} segments
 * from the root. Ids are immutable and share their ancestors by reference: a
 * child holds a pointer to its parent id and adds exactly one segment, so many
 * downstream scopes can reference the same ancestor path without copying it.
 *
 * <p>
 * Two hashes are cached:
 * <ul>
 * <li>{@link #hash()} covers level names and numbers and identifies one scope
 * instance.</li>
 * <li>{@link #levelHash()} covers level names only and is shared by every
 * instance of the same level position (e.g. all events of all runs).</li>
 * </ul>
 */
public final class LevelId {
    public static final String ROOT_LEVEL_NAME = "job";

    private static final LevelId BASE = new LevelId(null, 0, ROOT_LEVEL_NAME);

    private final LevelId parent;
    private final long number;
    private final String levelName;
    private final int depth;
    private final long hash;
    private final long levelHash;

    private LevelId(LevelId parent, long number, String levelName) {
        this.parent = parent;
        this.number = number;
        this.levelName = levelName;
        if (parent == null) {
            this.depth = 0;
            this.hash = Hashing.hash(levelName);
            this.levelHash = Hashing.hash(levelName);
        } else {
            this.depth = parent.depth + 1;
            this.hash = Hashing.hash(parent.hash, Hashing.hash(number), Hashing.hash(levelName));
            this.levelHash = Hashing.hash(parent.levelHash, levelName);
        }
    }

    /** The root id: level {@value #ROOT_LEVEL_NAME}, empty path. */
    public static LevelId base() {
        return BASE;
    }

    /** Returns a new id one level deeper than this one. */
    public LevelId makeChild(long levelNumber, String levelName) {
        Objects.requireNonNull(levelName, "levelName");
        if (levelName.isEmpty())
            throw new IllegalArgumentException("Level name must not be empty");
        if (levelNumber < 0)
            throw new IllegalArgumentException("Level number must not be negative: " + levelNumber);
        return new LevelId(this, levelNumber, levelName);
    }

    public boolean hasParent() {
        return parent != null;
    }

    /** @return the parent id, or null for the root. */
    public LevelId parent() {
        return parent;
    }

    /** Nearest id (this one or an ancestor) at the given level, or null. */
    public LevelId parent(String name) {
        for (LevelId id = this; id != null; id = id.parent) {
            if (id.levelName.equals(name))
                return id;
        }
        return null;
    }

    public long number() {
        return number;
    }

    public String levelName() {
        return levelName;
    }

    /** Number of segments in the path; zero for the root. */
    public int depth() {
        return depth;
    }

    public long hash() {
        return hash;
    }

    public long levelHash() {
        return levelHash;
    }

    /** True if {@code other} equals this id or is one of its ancestors. */
    public boolean hasPrefix(LevelId other) {
        if (other.depth > depth)
            return false;
        LevelId id = this;
        while (id.depth > other.depth)
            id = id.parent;
        return id.equals(other);
    }

    /** True if this id is a strict ancestor of {@code other}. */
    public boolean isAncestorOf(LevelId other) {
        return other.depth > depth && other.hasPrefix(this);
    }

    /** Path segments from the root (exclusive) down to this id. */
    public List<Segment> path() {
        List<Segment> segments = new ArrayList<>(depth);
        for (LevelId id = this; id.parent != null; id = id.parent)
            segments.add(new Segment(id.number, id.levelName));
        Collections.reverse(segments);
        return segments;
    }

    /** One element of a level path. */
    public record Segment(long number, String levelName) {
        @Override
        public String toString() {
            return levelName + ":" + number;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LevelId other))
            return false;
        if (hash != other.hash || depth != other.depth)
            return false;
        LevelId a = this;
        LevelId b = other;
        while (a != null) {
            if (a == b)
                return true;
            if (a.number != b.number || !a.levelName.equals(b.levelName))
                return false;
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(hash);
    }

    @Override
    public String toString() {
        return path().toString();
    }
}

package com.dataflow.sdg.node;

/** What a fold does with its accumulator once a partition is flushed. */
public enum FoldPolicy {
    /** The next partition instance starts from the initial value. */
    RESET_ON_FLUSH,
    /** The next partition instance starts from the last emitted value. */
    CARRY_OVER
}

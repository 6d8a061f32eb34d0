package com.dataflow.sdg.fn;

/**
 * Result of one unfold step.
 *
 * @param state   state passed to the next step
 * @param product product published in the new child scope
 */
public record UnfoldStep<S, R>(S state, R product) {
}

package com.dataflow.sdg.fn;

/**
 * Generator step of an unfold: derives the next state and one child product
 * from the current state.
 *
 * @param <S> state type
 * @param <R> child product type
 */
@FunctionalInterface
public interface Unfold<S, R> {
    UnfoldStep<S, R> next(S state);
}

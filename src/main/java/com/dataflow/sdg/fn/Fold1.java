package com.dataflow.sdg.fn;

/**
 * Accumulation step with one input.
 *
 * <p>
 * Returns the new accumulator. Implementations may update a mutable
 * accumulator in place and return it; calls for one partition are never
 * concurrent.
 *
 * @param <R> accumulator type
 * @param <A> input type
 */
@FunctionalInterface
public interface Fold1<R, A> {
    R fold(R accumulator, A a);
}

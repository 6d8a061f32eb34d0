package com.dataflow.sdg.fn;

/** One-input accumulation step invoked on a bound receiver. */
@FunctionalInterface
public interface BoundFold1<S, R, A> {
    R fold(S self, R accumulator, A a);
}

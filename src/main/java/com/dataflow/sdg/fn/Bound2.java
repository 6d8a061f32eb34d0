package com.dataflow.sdg.fn;

/** Two-input algorithm invoked on a bound receiver. */
@FunctionalInterface
public interface Bound2<S, A, B, R> {
    R apply(S self, A a, B b);
}

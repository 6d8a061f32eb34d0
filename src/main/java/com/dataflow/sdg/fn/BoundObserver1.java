package com.dataflow.sdg.fn;

/** One-input sink invoked on a bound receiver. */
@FunctionalInterface
public interface BoundObserver1<S, A> {
    void observe(S self, A a);
}

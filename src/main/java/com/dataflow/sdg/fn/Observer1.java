package com.dataflow.sdg.fn;

/** Side-effecting sink with one input. */
@FunctionalInterface
public interface Observer1<A> {
    void observe(A a);
}

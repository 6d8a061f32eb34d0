package com.dataflow.sdg.fn;

/** Side-effecting sink with two inputs. */
@FunctionalInterface
public interface Observer2<A, B> {
    void observe(A a, B b);
}

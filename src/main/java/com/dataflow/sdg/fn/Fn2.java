package com.dataflow.sdg.fn;

/** Algorithm with two inputs. */
@FunctionalInterface
public interface Fn2<A, B, R> {
    R apply(A a, B b);
}

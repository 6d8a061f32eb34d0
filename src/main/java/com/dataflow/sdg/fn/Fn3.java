package com.dataflow.sdg.fn;

/** Algorithm with three inputs. */
@FunctionalInterface
public interface Fn3<A, B, C, R> {
    R apply(A a, B b, C c);
}

package com.dataflow.sdg.fn;

/** Side-effecting sink with N inputs, passed in input-label order. */
@FunctionalInterface
public interface ObserverN {
    void observe(Object[] inputs);
}

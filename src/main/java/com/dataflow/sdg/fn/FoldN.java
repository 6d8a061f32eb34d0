package com.dataflow.sdg.fn;

/** Accumulation step with N inputs, passed in input-label order. */
@FunctionalInterface
public interface FoldN<R> {
    R fold(R accumulator, Object[] inputs);
}

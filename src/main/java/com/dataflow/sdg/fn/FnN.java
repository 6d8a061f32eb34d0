package com.dataflow.sdg.fn;

/**
 * Algorithm with N inputs, passed in input-label order.
 *
 * <p>
 * The array is allocated per invocation and owned by the callee; it may be
 * kept but is never reused by the framework.
 *
 * @param <R> result type
 */
@FunctionalInterface
public interface FnN<R> {
    R apply(Object[] inputs);
}

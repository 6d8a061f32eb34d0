package com.dataflow.sdg.fn;

/**
 * One-input algorithm invoked on a bound receiver, e.g. a method reference
 * {@code MyAlgorithm::apply}.
 *
 * @param <S> receiver type
 */
@FunctionalInterface
public interface Bound1<S, A, R> {
    R apply(S self, A a);
}

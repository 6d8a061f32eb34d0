package com.dataflow.sdg.fn;

/**
 * Algorithm with one input.
 *
 * <p>
 * Used for transforms and predicates. Examples:
 * <ul>
 * <li>{@code (Integer x) -> x * 2}</li>
 * <li>{@code String::length}</li>
 * </ul>
 *
 * @param <A> input type
 * @param <R> result type
 */
@FunctionalInterface
public interface Fn1<A, R> {
    R apply(A a);
}

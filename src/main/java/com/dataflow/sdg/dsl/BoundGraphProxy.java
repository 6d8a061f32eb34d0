package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.fn.Bound1;
import com.dataflow.sdg.fn.Bound2;
import com.dataflow.sdg.fn.BoundFold1;
import com.dataflow.sdg.fn.BoundObserver1;
import com.dataflow.sdg.fn.BoundOutput;
import com.dataflow.sdg.fn.Fn1;
import com.dataflow.sdg.fn.Fn2;

import java.util.function.Supplier;

/**
 * Graph proxy bound to one receiver object.
 *
 * <p>
 * Lets a module declare several algorithms that are methods of the same
 * object, e.g. {@code graph.make(Histogrammer::new).observe("fill",
 * Histogrammer::fill).inputFamily("energy")}. All algorithms declared here
 * share the receiver; with a concurrency above one the receiver must be
 * thread-safe.
 *
 * @param <S> receiver type
 */
public final class BoundGraphProxy<S> {
    private final GraphProxy graph;
    private final S receiver;

    BoundGraphProxy(GraphProxy graph, S receiver) {
        this.graph = graph;
        this.receiver = receiver;
    }

    public S receiver() {
        return receiver;
    }

    public <A, R> RegistrationApi transform(String name, Bound1<S, A, R> fn) {
        return transform(name, fn, Concurrency.SERIAL);
    }

    public <A, R> RegistrationApi transform(String name, Bound1<S, A, R> fn, Concurrency c) {
        Fn1<A, R> bound = a -> fn.apply(receiver, a);
        return graph.transform(name, bound, c);
    }

    public <A, B, R> RegistrationApi transform(String name, Bound2<S, A, B, R> fn) {
        return transform(name, fn, Concurrency.SERIAL);
    }

    public <A, B, R> RegistrationApi transform(String name, Bound2<S, A, B, R> fn, Concurrency c) {
        Fn2<A, B, R> bound = (a, b) -> fn.apply(receiver, a, b);
        return graph.transform(name, bound, c);
    }

    public <A> RegistrationApi predicate(String name, Bound1<S, A, Boolean> fn) {
        return predicate(name, fn, Concurrency.SERIAL);
    }

    public <A> RegistrationApi predicate(String name, Bound1<S, A, Boolean> fn, Concurrency c) {
        Fn1<A, Boolean> bound = a -> fn.apply(receiver, a);
        return graph.predicate(name, bound, c);
    }

    public <A> RegistrationApi observe(String name, BoundObserver1<S, A> fn) {
        return observe(name, fn, Concurrency.SERIAL);
    }

    public <A> RegistrationApi observe(String name, BoundObserver1<S, A> fn, Concurrency c) {
        return graph.<A>observe(name, a -> fn.observe(receiver, a), c);
    }

    public <R, A> FoldApi fold(String name, BoundFold1<S, R, A> fn, Supplier<R> initial) {
        return fold(name, fn, initial, Concurrency.SERIAL);
    }

    public <R, A> FoldApi fold(String name, BoundFold1<S, R, A> fn, Supplier<R> initial, Concurrency c) {
        return graph.<R, A>fold(name, (acc, a) -> fn.fold(receiver, acc, a), initial, c);
    }

    public OutputApi output(String name, BoundOutput<S> fn) {
        return output(name, fn, Concurrency.SERIAL);
    }

    public OutputApi output(String name, BoundOutput<S> fn, Concurrency c) {
        return graph.output(name, store -> fn.write(receiver, store), c);
    }
}

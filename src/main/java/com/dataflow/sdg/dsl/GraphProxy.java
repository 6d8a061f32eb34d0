package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.config.Configuration;
import com.dataflow.sdg.engine.NodeCatalog;
import com.dataflow.sdg.fn.Fn1;
import com.dataflow.sdg.fn.Fn2;
import com.dataflow.sdg.fn.Fn3;
import com.dataflow.sdg.fn.FnN;
import com.dataflow.sdg.fn.Fold1;
import com.dataflow.sdg.fn.FoldN;
import com.dataflow.sdg.fn.Observer1;
import com.dataflow.sdg.fn.Observer2;
import com.dataflow.sdg.fn.ObserverN;
import com.dataflow.sdg.fn.OutputFn;
import com.dataflow.sdg.fn.Unfold;
import com.dataflow.sdg.fn.UnfoldStep;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.node.DeclaredObserver;
import com.dataflow.sdg.node.DeclaredOutput;
import com.dataflow.sdg.node.DeclaredPredicate;
import com.dataflow.sdg.node.DeclaredTransform;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Graph proxy -- the API a module uses to declare its algorithms.
 *
 * <p>
 * Usage pattern, inside {@code GraphModule.create(graph, config)}:
 *
 * <pre>
 * graph.transform("square", (Integer x) -&gt; x * x).inputFamily("number");
 * graph.fold("sum", (Integer acc, Integer x) -&gt; acc + x, () -&gt; 0)
 *      .partitionedBy("run")
 *      .inputFamily("square");
 * graph.predicate("positive", (Integer x) -&gt; x &gt; 0).inputFamily("number");
 * graph.output("writer", store -&gt; ...).when("positive");
 * </pre>
 *
 * <p>
 * Each statement produces one node. Nodes are committed when the statement
 * names its outputs, when {@code register()} is called, or at the latest when
 * the proxy is closed; the framework closes the proxy right after the module
 * entry point returns. Every algorithm runs with {@link Concurrency#SERIAL}
 * unless a concurrency is given.
 *
 * <p>
 * The N-input variants ({@code transformN}, {@code predicateN},
 * {@code observeN}, {@code foldN}) accept any number of input labels and
 * receive the inputs as an array in label order.
 *
 * <p>
 * Not thread-safe; used only during the build phase.
 */
public final class GraphProxy implements AutoCloseable {
    private final Glue glue;

    public GraphProxy(NodeCatalog catalog, Configuration config) {
        this(new Glue(catalog, config));
    }

    GraphProxy(Glue glue) {
        this.glue = glue;
    }

    public Configuration config() {
        return glue.config();
    }

    // ── Bound receivers ──────────────────────────────────────────

    /**
     * Creates one receiver object shared by every statement declared through
     * the returned proxy.
     */
    public <S> BoundGraphProxy<S> make(Supplier<S> factory) {
        return make(factory.get());
    }

    public <S> BoundGraphProxy<S> make(S receiver) {
        return new BoundGraphProxy<>(this, Objects.requireNonNull(receiver, "receiver"));
    }

    // ── Transforms ───────────────────────────────────────────────

    public <A, R> RegistrationApi transform(String name, Fn1<A, R> fn) {
        return transform(name, fn, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <A, R> RegistrationApi transform(String name, Fn1<A, R> fn, Concurrency c) {
        return transformApi(name, c, 1, args -> fn.apply((A) args[0]));
    }

    public <A, B, R> RegistrationApi transform(String name, Fn2<A, B, R> fn) {
        return transform(name, fn, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <A, B, R> RegistrationApi transform(String name, Fn2<A, B, R> fn, Concurrency c) {
        return transformApi(name, c, 2, args -> fn.apply((A) args[0], (B) args[1]));
    }

    public <A, B, C, R> RegistrationApi transform(String name, Fn3<A, B, C, R> fn) {
        return transform(name, fn, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <A, B, C, R> RegistrationApi transform(String name, Fn3<A, B, C, R> fn, Concurrency c) {
        return transformApi(name, c, 3, args -> fn.apply((A) args[0], (B) args[1], (C) args[2]));
    }

    public <R> RegistrationApi transformN(String name, FnN<R> fn) {
        return transformN(name, fn, Concurrency.SERIAL);
    }

    public <R> RegistrationApi transformN(String name, FnN<R> fn, Concurrency c) {
        return transformApi(name, c, RegistrationApi.VARIADIC, fn);
    }

    private RegistrationApi transformApi(String name, Concurrency c, int arity, FnN<?> body) {
        AlgorithmName alg = glue.algorithmName(name);
        Registrar registrar = glue.open(NodeKind.TRANSFORM, alg);
        return new RegistrationApi(registrar, NodeKind.TRANSFORM, alg, arity,
                (inputs, predicates, outputs) -> new DeclaredTransform(alg, c, inputs, outputs, predicates, body));
    }

    // ── Predicates ───────────────────────────────────────────────

    public <A> RegistrationApi predicate(String name, Fn1<A, Boolean> fn) {
        return predicate(name, fn, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <A> RegistrationApi predicate(String name, Fn1<A, Boolean> fn, Concurrency c) {
        return predicateApi(name, c, 1, args -> fn.apply((A) args[0]));
    }

    public <A, B> RegistrationApi predicate(String name, Fn2<A, B, Boolean> fn) {
        return predicate(name, fn, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <A, B> RegistrationApi predicate(String name, Fn2<A, B, Boolean> fn, Concurrency c) {
        return predicateApi(name, c, 2, args -> fn.apply((A) args[0], (B) args[1]));
    }

    public RegistrationApi predicateN(String name, FnN<Boolean> fn) {
        return predicateN(name, fn, Concurrency.SERIAL);
    }

    public RegistrationApi predicateN(String name, FnN<Boolean> fn, Concurrency c) {
        return predicateApi(name, c, RegistrationApi.VARIADIC, fn);
    }

    private RegistrationApi predicateApi(String name, Concurrency c, int arity, FnN<Boolean> body) {
        AlgorithmName alg = glue.algorithmName(name);
        Registrar registrar = glue.open(NodeKind.PREDICATE, alg);
        return new RegistrationApi(registrar, NodeKind.PREDICATE, alg, arity,
                (inputs, predicates, outputs) -> new DeclaredPredicate(alg, c, inputs, predicates, body));
    }

    // ── Observers ────────────────────────────────────────────────

    public <A> RegistrationApi observe(String name, Observer1<A> fn) {
        return observe(name, fn, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <A> RegistrationApi observe(String name, Observer1<A> fn, Concurrency c) {
        return observeApi(name, c, 1, args -> fn.observe((A) args[0]));
    }

    public <A, B> RegistrationApi observe(String name, Observer2<A, B> fn) {
        return observe(name, fn, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <A, B> RegistrationApi observe(String name, Observer2<A, B> fn, Concurrency c) {
        return observeApi(name, c, 2, args -> fn.observe((A) args[0], (B) args[1]));
    }

    public RegistrationApi observeN(String name, ObserverN fn) {
        return observeN(name, fn, Concurrency.SERIAL);
    }

    public RegistrationApi observeN(String name, ObserverN fn, Concurrency c) {
        return observeApi(name, c, RegistrationApi.VARIADIC, fn);
    }

    private RegistrationApi observeApi(String name, Concurrency c, int arity, ObserverN body) {
        AlgorithmName alg = glue.algorithmName(name);
        Registrar registrar = glue.open(NodeKind.OBSERVE, alg);
        return new RegistrationApi(registrar, NodeKind.OBSERVE, alg, arity,
                (inputs, predicates, outputs) -> new DeclaredObserver(alg, c, inputs, predicates, body));
    }

    // ── Folds ────────────────────────────────────────────────────

    public <R, A> FoldApi fold(String name, Fold1<R, A> fn, Supplier<R> initial) {
        return fold(name, fn, initial, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <R, A> FoldApi fold(String name, Fold1<R, A> fn, Supplier<R> initial, Concurrency c) {
        return foldApi(name, c, 1, (acc, args) -> fn.fold((R) acc, (A) args[0]), initial);
    }

    public <R> FoldApi foldN(String name, FoldN<R> fn, Supplier<R> initial) {
        return foldN(name, fn, initial, Concurrency.SERIAL);
    }

    @SuppressWarnings("unchecked")
    public <R> FoldApi foldN(String name, FoldN<R> fn, Supplier<R> initial, Concurrency c) {
        return foldApi(name, c, RegistrationApi.VARIADIC, (acc, args) -> fn.fold((R) acc, args), initial);
    }

    private FoldApi foldApi(String name, Concurrency c, int arity, FoldN<Object> body, Supplier<?> initial) {
        AlgorithmName alg = glue.algorithmName(name);
        Registrar registrar = glue.open(NodeKind.FOLD, alg);
        return new FoldApi(registrar, alg, c, arity, body, initial);
    }

    // ── Unfolds ──────────────────────────────────────────────────

    public <S, R> UnfoldApi unfold(String name, Predicate<S> more, Unfold<S, R> step, String destinationLevel) {
        return unfold(name, more, step, destinationLevel, Concurrency.SERIAL);
    }

    /**
     * Declares a generator of child scopes.
     *
     * @param more             continue while this holds for the current state
     * @param step             next state and child product
     * @param destinationLevel level name of the created child scopes
     */
    @SuppressWarnings("unchecked")
    public <S, R> UnfoldApi unfold(String name, Predicate<S> more, Unfold<S, R> step, String destinationLevel,
            Concurrency c) {
        AlgorithmName alg = glue.algorithmName(name);
        Registrar registrar = glue.open(NodeKind.UNFOLD, alg);
        Predicate<Object> test = state -> more.test((S) state);
        Unfold<Object, Object> next = state -> {
            UnfoldStep<S, R> result = step.next((S) state);
            return result == null ? null : new UnfoldStep<>(result.state(), result.product());
        };
        return new UnfoldApi(registrar, alg, c, test, next, destinationLevel);
    }

    // ── Outputs ──────────────────────────────────────────────────

    public OutputApi output(String name, OutputFn fn) {
        return output(name, fn, Concurrency.SERIAL);
    }

    public OutputApi output(String name, OutputFn fn, Concurrency c) {
        AlgorithmName alg = glue.algorithmName(name);
        Registrar registrar = glue.open(NodeKind.OUTPUT, alg);
        registrar.setCreator((predicates, outputs) -> new DeclaredOutput(alg, c, predicates, fn));
        return new OutputApi(registrar);
    }

    /**
     * Commits every statement that is still open, in declaration order.
     *
     * @throws IllegalStateException if a statement never declared its inputs
     */
    @Override
    public void close() {
        glue.sweep();
    }
}

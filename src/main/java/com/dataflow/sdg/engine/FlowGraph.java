package com.dataflow.sdg.engine;

import com.dataflow.sdg.api.ExecutionListener;
import com.dataflow.sdg.api.ExecutionSubstrate;
import com.dataflow.sdg.api.Node;
import com.dataflow.sdg.api.NodeFailure;
import com.dataflow.sdg.fn.UnfoldStep;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.LevelHierarchy;
import com.dataflow.sdg.model.LevelId;
import com.dataflow.sdg.model.ProductStore;
import com.dataflow.sdg.model.Products;
import com.dataflow.sdg.model.QualifiedName;
import com.dataflow.sdg.node.DeclaredFold;
import com.dataflow.sdg.node.DeclaredObserver;
import com.dataflow.sdg.node.DeclaredOutput;
import com.dataflow.sdg.node.DeclaredPredicate;
import com.dataflow.sdg.node.DeclaredTransform;
import com.dataflow.sdg.node.DeclaredUnfold;
import com.dataflow.sdg.node.FoldPolicy;
import com.dataflow.sdg.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Reactive execution substrate for a bound node catalog.
 *
 * <p>
 * Stores are pushed through the graph as they are published:
 * <ol>
 * <li><b>Routing:</b> a data store is announced with the qualified names of
 * its fresh products (every local product for a source store or an unfold
 * child, the node's outputs for a continuation). It is delivered to every
 * node with an input label matching a fresh name, and to every output
 * node.</li>
 * <li><b>Joining:</b> each node keeps one join entry per scope id. Input
 * slots are filled from delivered stores, from stores already published for
 * the same scope or an ancestor scope, or later from an ancestor store
 * published after the entry was opened. When every slot is filled and every
 * gating predicate has decided, the node fires with the most derived slot
 * store as its output scope. A false predicate drops the tuple.</li>
 * <li><b>Scheduling:</b> invocations go through the node's
 * {@link ConcurrencyLimiter}; node bodies never block on each other.</li>
 * <li><b>Flushing:</b> a flush of scope F waits in the {@link ScopeTracker}
 * until no work is in flight at or below F. It then emits the accumulators
 * of folds partitioned at F's level and discards join state below F.</li>
 * </ol>
 *
 * <p>
 * A throwing node body fails only that invocation. The failure is recorded,
 * reported to the {@link ExecutionListener} and logged with rate limiting;
 * nodes waiting for the failed node's products in that scope never fire.
 */
public final class FlowGraph implements ExecutionSubstrate {
    private static final Logger log = LogManager.getLogger(FlowGraph.class);

    private static final ExecutionListener NO_LISTENER = new ExecutionListener() {
        @Override
        public void onNodeExecuted(String nodeName, LevelId id, long durationNanos) {
        }

        @Override
        public void onNodeError(String nodeName, LevelId id, Throwable error) {
        }
    };

    private final ExecutorService executor;
    private final LevelHierarchy hierarchy;
    private final ExecutionListener listener;
    private final ErrorRateLimiter errorLog = new ErrorRateLimiter(log, 1000);
    private final ScopeTracker tracker = new ScopeTracker();
    private final Queue<NodeFailure> failures = new ConcurrentLinkedQueue<>();
    private final CountDownLatch rootFlushed = new CountDownLatch(1);

    // Wiring, written once by bind()
    private final List<NodeRuntime> runtimes = new ArrayList<>();
    private final Map<String, List<JoinRuntime>> consumersByProduct = new HashMap<>();
    private final List<OutputRuntime> outputs = new ArrayList<>();
    private final List<JoinRuntime> folds = new ArrayList<>();
    private final Map<String, List<NodeRuntime>> gatedBy = new HashMap<>();
    private volatile boolean bound;

    // Per-scope run state
    private final ConcurrentMap<LevelId, List<Published>> published = new ConcurrentHashMap<>();
    private final ConcurrentMap<LevelId, ConcurrentMap<String, Boolean>> decisions = new ConcurrentHashMap<>();

    /** A published data store and the names it was announced with. */
    private record Published(ProductStore store, List<QualifiedName> fresh) {
    }

    public FlowGraph(ExecutorService executor, LevelHierarchy hierarchy, ExecutionListener listener) {
        this.executor = executor;
        this.hierarchy = hierarchy;
        this.listener = listener == null ? NO_LISTENER : listener;
    }

    // ── ExecutionSubstrate ───────────────────────────────────────

    @Override
    public void bind(NodeCatalog catalog) {
        if (bound)
            throw new IllegalStateException("FlowGraph is already bound");
        for (Node node : catalog.nodes()) {
            NodeRuntime rt;
            if (node instanceof DeclaredOutput output) {
                OutputRuntime out = new OutputRuntime(output);
                outputs.add(out);
                rt = out;
            } else {
                JoinRuntime join = new JoinRuntime(node);
                for (Label label : node.inputs())
                    consumersByProduct.computeIfAbsent(label.name(), k -> new ArrayList<>()).add(join);
                if (node instanceof DeclaredFold)
                    folds.add(join);
                rt = join;
            }
            for (String spec : node.predicates()) {
                String predicate = catalog.predicate(spec).fullName();
                rt.predicates.add(predicate);
                gatedBy.computeIfAbsent(predicate, k -> new ArrayList<>()).add(rt);
            }
            runtimes.add(rt);
        }
        bound = true;
        log.info("Bound {} nodes ({} outputs, {} folds)", runtimes.size(), outputs.size(), folds.size());
    }

    @Override
    public void publish(ProductStore store) {
        if (!bound)
            throw new IllegalStateException("FlowGraph must be bound before publishing");
        if (store.isFlush())
            publishFlush(store);
        else
            publishData(store, sourceNames(store));
    }

    @Override
    public void awaitCompletion() throws InterruptedException {
        rootFlushed.await();
        tracker.awaitIdle();
    }

    /** Like {@link #awaitCompletion()} with a timeout; returns false on timeout. */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        if (!rootFlushed.await(timeout, unit))
            return false;
        tracker.awaitIdle();
        return true;
    }

    @Override
    public List<NodeFailure> failures() {
        return List.copyOf(failures);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS))
                log.warn("Worker pool did not terminate within 5s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ── Routing ──────────────────────────────────────────────────

    private static List<QualifiedName> sourceNames(ProductStore store) {
        AlgorithmName producer = store.source().isEmpty() ? AlgorithmName.unspecified()
                : new AlgorithmName("", store.source(), AlgorithmName.SpecifiedFields.EITHER);
        List<QualifiedName> names = new ArrayList<>();
        for (String product : store.productNames())
            names.add(new QualifiedName(producer, product));
        return names;
    }

    private void publishData(ProductStore store, List<QualifiedName> fresh) {
        LevelId id = store.id();
        tracker.enter(id);
        try {
            published.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(new Published(store, fresh));
            Set<JoinRuntime> targets = new LinkedHashSet<>();
            for (QualifiedName name : fresh) {
                for (JoinRuntime rt : consumersByProduct.getOrDefault(name.name(), List.of())) {
                    if (rt.consumes(name))
                        targets.add(rt);
                }
            }
            if (log.isTraceEnabled())
                log.trace("Routing {} {} to {} node(s)", id, fresh, targets.size());
            for (JoinRuntime rt : targets)
                rt.deliver(store, fresh);
            for (OutputRuntime out : outputs)
                out.offer(store);
        } finally {
            tracker.exit(id);
        }
    }

    private void publishFlush(ProductStore flush) {
        LevelId id = flush.id();
        LevelId parent = id.parent();
        if (parent != null)
            tracker.enter(parent);
        tracker.whenIdle(id, () -> {
            try {
                handleFlush(id);
            } finally {
                if (parent != null)
                    tracker.exit(parent);
                else
                    rootFlushed.countDown();
            }
        });
    }

    private void handleFlush(LevelId id) {
        log.debug("Flushing scope {}", id);
        for (JoinRuntime rt : folds) {
            if (((DeclaredFold) rt.node).partition().equals(id.levelName()))
                emitFold(rt, id);
        }
        for (NodeRuntime rt : runtimes)
            rt.discard(id);
        published.keySet().removeIf(id::isAncestorOf);
        decisions.keySet().removeIf(id::isAncestorOf);
        for (JoinRuntime rt : folds)
            rt.fold.carried.keySet().removeIf(k -> k.hasPrefix(id));
    }

    private void recordDecision(String predicate, LevelId id, boolean result) {
        decisions.computeIfAbsent(id, k -> new ConcurrentHashMap<>()).put(predicate, result);
        for (NodeRuntime rt : gatedBy.getOrDefault(predicate, List.of()))
            rt.onDecision(id);
    }

    /**
     * Combined decision of the named predicates for a scope: each predicate's
     * nearest result at the scope or an ancestor.
     *
     * @return FALSE if any known result is false, TRUE if all are known and
     *         true, null if still undecided
     */
    private Boolean decide(List<String> predicates, LevelId id) {
        boolean undecided = false;
        for (String predicate : predicates) {
            Boolean result = null;
            for (LevelId p = id; p != null && result == null; p = p.parent()) {
                Map<String, Boolean> known = decisions.get(p);
                if (known != null)
                    result = known.get(predicate);
            }
            if (result == null)
                undecided = true;
            else if (!result)
                return Boolean.FALSE;
        }
        return undecided ? null : Boolean.TRUE;
    }

    // ── Invocation ───────────────────────────────────────────────

    private void schedule(NodeRuntime rt, LevelId id, Runnable body) {
        tracker.enter(id);
        rt.limiter.submit(() -> {
            long start = System.nanoTime();
            try {
                body.run();
                listener.onNodeExecuted(rt.node.fullName(), id, System.nanoTime() - start);
            } catch (Throwable t) {
                fail(rt.node, id, t);
            } finally {
                tracker.exit(id);
            }
        });
    }

    private void fail(Node node, LevelId id, Throwable error) {
        failures.add(new NodeFailure(node.fullName(), id, error));
        try {
            listener.onNodeError(node.fullName(), id, error);
        } catch (RuntimeException e) {
            log.warn("Execution listener failed while reporting {}", node.fullName(), e);
        }
        errorLog.log(node.fullName(), "Node " + node.fullName() + " failed for scope " + id, error);
    }

    private void invoke(JoinRuntime rt, ProductStore[] slots) {
        ProductStore scope = ProductStore.mostDerived(Arrays.asList(slots));
        List<Label> inputs = rt.node.inputs();
        Object[] args = new Object[slots.length];
        for (int i = 0; i < slots.length; i++)
            args[i] = slots[i].getValue(inputs.get(i).name());

        Node node = rt.node;
        if (node instanceof DeclaredTransform transform) {
            List<?> values = transform.invoke(args);
            Products products = new Products();
            for (int i = 0; i < values.size(); i++)
                products.add(transform.outputs().get(i).name(), values.get(i));
            publishData(scope.makeContinuation(node.fullName(), products), node.outputs());
        } else if (node instanceof DeclaredPredicate predicate) {
            recordDecision(node.fullName(), scope.id(), predicate.evaluate(args));
        } else if (node instanceof DeclaredObserver observer) {
            observer.observe(args);
        } else if (node instanceof DeclaredFold fold) {
            accumulate(rt.fold, fold, scope, args);
        } else if (node instanceof DeclaredUnfold unfold) {
            expand(unfold, scope, args[0]);
        } else {
            throw new IllegalStateException("Unsupported node " + node);
        }
    }

    private void accumulate(FoldState state, DeclaredFold fold, ProductStore scope, Object[] args) {
        ProductStore partition = scope.parent(fold.partition());
        if (partition == null)
            throw new IllegalStateException("Fold " + fold.fullName() + " has no '" + fold.partition()
                    + "' scope above " + scope.id());
        Accumulator acc = state.accumulators.computeIfAbsent(partition.id(),
                k -> new Accumulator(partition, initialValue(state, fold, k)));
        synchronized (acc) {
            acc.value = fold.fold(acc.value, args);
        }
    }

    private static Object initialValue(FoldState state, DeclaredFold fold, LevelId partition) {
        if (fold.policy() == FoldPolicy.CARRY_OVER && partition.hasParent()) {
            Object carried = state.carried.get(partition.parent());
            if (carried != null)
                return carried;
        }
        return fold.initialValue();
    }

    private void emitFold(JoinRuntime rt, LevelId id) {
        Accumulator acc = rt.fold.accumulators.remove(id);
        if (acc == null)
            return;
        DeclaredFold fold = (DeclaredFold) rt.node;
        Object value;
        synchronized (acc) {
            value = acc.value;
        }
        try {
            Products products = Products.of(fold.outputs().get(0).name(), value);
            ProductStore result = acc.partition.makeContinuation(fold.fullName(), products);
            if (fold.policy() == FoldPolicy.CARRY_OVER && id.hasParent())
                rt.fold.carried.put(id.parent(), value);
            publishData(result, fold.outputs());
        } catch (RuntimeException e) {
            fail(fold, id, e);
        }
    }

    private void expand(DeclaredUnfold unfold, ProductStore scope, Object initial) {
        String product = unfold.outputs().get(0).name();
        Object state = initial;
        long number = 0;
        while (unfold.hasMore(state)) {
            UnfoldStep<Object, Object> step = unfold.next(state);
            ProductStore child = scope.makeChild(number++, unfold.destinationLevel(), unfold.fullName(),
                    Products.of(product, step.product()));
            hierarchy.incrementCount(child.id());
            publishData(child, unfold.outputs());
            publishFlush(child.makeFlush());
            state = step.state();
        }
        log.trace("Unfold {} created {} '{}' scope(s) under {}", unfold.fullName(), number,
                unfold.destinationLevel(), scope.id());
    }

    // ── Runtimes ─────────────────────────────────────────────────

    /** Per-node wiring and run state. */
    private abstract class NodeRuntime {
        final Node node;
        final ConcurrencyLimiter limiter;
        final List<String> predicates = new ArrayList<>();

        NodeRuntime(Node node) {
            this.node = node;
            this.limiter = new ConcurrencyLimiter(executor, node.concurrency());
        }

        /** A predicate result became known for scope {@code id}. */
        abstract void onDecision(LevelId id);

        /** Drops state that can no longer complete once {@code flushed} is flushed. */
        abstract void discard(LevelId flushed);
    }

    private static final class JoinEntry {
        final LevelId id;
        final ProductStore[] slots;
        int filled;
        boolean done;

        JoinEntry(LevelId id, int size) {
            this.id = id;
            this.slots = new ProductStore[size];
        }
    }

    private static final class Accumulator {
        final ProductStore partition;
        Object value;

        Accumulator(ProductStore partition, Object value) {
            this.partition = partition;
            this.value = value;
        }
    }

    private static final class FoldState {
        final ConcurrentMap<LevelId, Accumulator> accumulators = new ConcurrentHashMap<>();
        final ConcurrentMap<LevelId, Object> carried = new ConcurrentHashMap<>();
    }

    /** Runtime of every node kind that consumes input labels. */
    private final class JoinRuntime extends NodeRuntime {
        final List<Label> inputs;
        final FoldState fold;
        private final Map<LevelId, JoinEntry> entries = new HashMap<>();

        JoinRuntime(Node node) {
            super(node);
            this.inputs = node.inputs();
            this.fold = node instanceof DeclaredFold ? new FoldState() : null;
        }

        boolean consumes(QualifiedName product) {
            for (Label label : inputs) {
                if (label.matches(product))
                    return true;
            }
            return false;
        }

        void deliver(ProductStore store, List<QualifiedName> fresh) {
            List<JoinEntry> ready = new ArrayList<>();
            synchronized (this) {
                JoinEntry entry = entries.computeIfAbsent(store.id(), k -> new JoinEntry(k, inputs.size()));
                if (!entry.done) {
                    fillFresh(entry, store, fresh);
                    fillPublished(entry, store);
                    addIfReady(entry, ready);
                } else {
                    log.trace("{} ignores repeated input for {}", node.fullName(), store.id());
                }
                // Ancestor products completing entries opened by descendants
                for (JoinEntry waiting : entries.values()) {
                    if (!waiting.done && store.id().isAncestorOf(waiting.id)) {
                        fillFresh(waiting, store, fresh);
                        addIfReady(waiting, ready);
                    }
                }
            }
            fire(ready);
        }

        @Override
        void onDecision(LevelId id) {
            List<JoinEntry> ready = new ArrayList<>();
            synchronized (this) {
                for (JoinEntry entry : entries.values()) {
                    if (!entry.done && entry.id.hasPrefix(id))
                        addIfReady(entry, ready);
                }
            }
            fire(ready);
        }

        @Override
        synchronized void discard(LevelId flushed) {
            for (Iterator<JoinEntry> it = entries.values().iterator(); it.hasNext();) {
                JoinEntry entry = it.next();
                if (flushed.isAncestorOf(entry.id) || (entry.done && entry.id.equals(flushed))) {
                    if (!entry.done && log.isDebugEnabled())
                        log.debug("{} discards incomplete input for {} ({}/{} inputs)", node.fullName(), entry.id,
                                entry.filled, inputs.size());
                    it.remove();
                }
            }
        }

        private void fillFresh(JoinEntry entry, ProductStore store, List<QualifiedName> fresh) {
            for (int i = 0; i < inputs.size(); i++) {
                if (entry.slots[i] != null)
                    continue;
                for (QualifiedName name : fresh) {
                    if (inputs.get(i).matches(name)) {
                        entry.slots[i] = store;
                        entry.filled++;
                        break;
                    }
                }
            }
        }

        private void fillPublished(JoinEntry entry, ProductStore store) {
            for (int i = 0; i < inputs.size() && entry.filled < inputs.size(); i++) {
                if (entry.slots[i] != null)
                    continue;
                Label label = inputs.get(i);
                ProductStore found = findPublished(label, entry.id);
                if (found == null && !label.isQualified() && store.parent() != null)
                    found = store.parent().storeForProduct(label.name()).orElse(null);
                if (found != null) {
                    entry.slots[i] = found;
                    entry.filled++;
                }
            }
        }

        private ProductStore findPublished(Label label, LevelId id) {
            for (LevelId p = id; p != null; p = p.parent()) {
                List<Published> stores = published.get(p);
                if (stores == null)
                    continue;
                for (Published pub : stores) {
                    for (QualifiedName name : pub.fresh()) {
                        if (label.matches(name))
                            return pub.store();
                    }
                }
            }
            return null;
        }

        private void addIfReady(JoinEntry entry, List<JoinEntry> ready) {
            if (entry.filled < inputs.size())
                return;
            Boolean gate = predicates.isEmpty() ? Boolean.TRUE : decide(predicates, entry.id);
            if (gate == null)
                return;
            entry.done = true;
            if (gate)
                ready.add(entry);
            else
                log.trace("{} skipped for {}: predicate false", node.fullName(), entry.id);
        }

        private void fire(List<JoinEntry> ready) {
            for (JoinEntry entry : ready) {
                ProductStore[] slots = entry.slots.clone();
                schedule(this, entry.id, () -> invoke(this, slots));
            }
        }
    }

    /** Runtime of an output node: receives whole stores, optionally gated. */
    private final class OutputRuntime extends NodeRuntime {
        private final DeclaredOutput output;
        private final List<ProductStore> pending = new ArrayList<>();

        OutputRuntime(DeclaredOutput output) {
            super(output);
            this.output = output;
        }

        void offer(ProductStore store) {
            if (predicates.isEmpty()) {
                write(store);
                return;
            }
            Boolean gate;
            synchronized (this) {
                gate = decide(predicates, store.id());
                if (gate == null) {
                    pending.add(store);
                    return;
                }
            }
            if (gate)
                write(store);
        }

        @Override
        void onDecision(LevelId id) {
            List<ProductStore> accepted = new ArrayList<>();
            synchronized (this) {
                for (Iterator<ProductStore> it = pending.iterator(); it.hasNext();) {
                    ProductStore store = it.next();
                    if (!store.id().hasPrefix(id))
                        continue;
                    Boolean gate = decide(predicates, store.id());
                    if (gate != null) {
                        it.remove();
                        if (gate)
                            accepted.add(store);
                    }
                }
            }
            for (ProductStore store : accepted)
                write(store);
        }

        @Override
        synchronized void discard(LevelId flushed) {
            pending.removeIf(store -> flushed.isAncestorOf(store.id()));
        }

        private void write(ProductStore store) {
            schedule(this, store.id(), () -> output.write(store));
        }
    }
}

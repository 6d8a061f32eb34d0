package com.dataflow.sdg;

import com.dataflow.sdg.api.ExecutionListener;
import com.dataflow.sdg.api.GraphModule;
import com.dataflow.sdg.api.NextStore;
import com.dataflow.sdg.api.NodeFailure;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.config.Configuration;
import com.dataflow.sdg.disruptor.RingBufferDriver;
import com.dataflow.sdg.dsl.GraphProxy;
import com.dataflow.sdg.engine.FlowGraph;
import com.dataflow.sdg.engine.NodeCatalog;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.LevelHierarchy;
import com.dataflow.sdg.util.CompositeExecutionListener;
import com.dataflow.sdg.util.GraphExplain;
import com.dataflow.sdg.util.NodeProfileListener;
import com.dataflow.sdg.util.ResourceUsage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Builds a graph from modules and runs it against a source.
 *
 * <p>
 * This class handles:
 * <ul>
 * <li>Calling every module entry point with its own {@link GraphProxy} and
 * finalizing the statements it left open</li>
 * <li>Validating the catalog and refusing to run on any build error</li>
 * <li>Setting up the {@link FlowGraph} and its worker pool</li>
 * <li>Driving the source through the LMAX Disruptor ring</li>
 * </ul>
 *
 * <pre>
 * Framework framework = Framework.builder()
 *         .module(new MyAlgorithms(), Configuration.of(Map.of("module_label", "reco")))
 *         .source(driver -&gt; { ... })
 *         .build();
 * RunResult result = framework.run();
 * </pre>
 */
@Log4j2
public final class Framework {
    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;

    @Getter
    private final NodeCatalog catalog;
    private final NextStore source;
    private final int threads;
    private final int ringBufferSize;
    private final CompositeExecutionListener listeners;

    private Framework(Builder builder, NodeCatalog catalog) {
        this.catalog = catalog;
        this.source = builder.source;
        this.threads = builder.threads;
        this.ringBufferSize = builder.ringBufferSize;
        this.listeners = new CompositeExecutionListener();
        for (ExecutionListener l : builder.listeners)
            listeners.add(l);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a listener on top of the ones given to the builder.
     */
    public void addListener(ExecutionListener listener) {
        listeners.add(listener);
    }

    /** Enables per-node profiling; use the returned listener to dump statistics. */
    public NodeProfileListener enableNodeProfiling() {
        NodeProfileListener profile = new NodeProfileListener();
        listeners.add(profile);
        return profile;
    }

    public String explain() {
        return new GraphExplain(catalog).dumpTopology();
    }

    /**
     * Runs the source to completion and waits until every scope is flushed.
     *
     * <p>
     * A failing node does not stop the run; its failures are reported in the
     * result.
     *
     * @throws IllegalStateException if the source failed, in which case the run
     *                               is aborted
     */
    public RunResult run() {
        LevelHierarchy hierarchy = new LevelHierarchy();
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        FlowGraph graph = new FlowGraph(pool, hierarchy, listeners);
        graph.bind(catalog);

        long wallNanos;
        try (ResourceUsage usage = new ResourceUsage()) {
            RingBufferDriver driver = new RingBufferDriver(graph, hierarchy, ringBufferSize);
            try {
                source.next(driver);
            } catch (RuntimeException e) {
                driver.abort();
                throw new IllegalStateException("Source failed; run aborted", e);
            }
            driver.finish();
            driver.close();
            driver.checkPublisher();
            graph.awaitCompletion();
            wallNanos = usage.wallNanos();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the run to complete", e);
        } finally {
            graph.shutdown();
        }

        hierarchy.print();
        List<NodeFailure> failures = graph.failures();
        if (!failures.isEmpty())
            log.warn("Run finished with {} node failure(s)", failures.size());
        return new RunResult(failures, hierarchy, wallNanos);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "sdg-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /** Collects modules and run settings. */
    public static final class Builder {
        private record ModuleEntry(GraphModule module, Configuration config) {
        }

        private final List<ModuleEntry> modules = new ArrayList<>();
        private final List<AlgorithmName> externalProducers = new ArrayList<>();
        private final List<ExecutionListener> listeners = new ArrayList<>();
        private NextStore source;
        private int threads = Runtime.getRuntime().availableProcessors();
        private int ringBufferSize = DEFAULT_RING_BUFFER_SIZE;

        private Builder() {
        }

        public Builder module(GraphModule module) {
            return module(module, Configuration.empty());
        }

        public Builder module(GraphModule module, Configuration config) {
            modules.add(new ModuleEntry(Objects.requireNonNull(module, "module"),
                    Objects.requireNonNull(config, "config")));
            return this;
        }

        public Builder source(NextStore source) {
            this.source = Objects.requireNonNull(source, "source");
            return this;
        }

        /** Source class adapted by {@link SourceFactory}. */
        public Builder source(Class<?> type, Configuration config) {
            return source(SourceFactory.create(type, config));
        }

        /**
         * Declares a producer outside the graph, typically the source tag of the
         * stores a source yields, so that inputs qualified with it validate.
         */
        public Builder externalProducer(String name) {
            externalProducers.add(AlgorithmName.create(name));
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1)
                throw new IllegalArgumentException("threads must be >= 1, got " + threads);
            this.threads = threads;
            return this;
        }

        /** Size of the source ring; must be a power of two. */
        public Builder ringBufferSize(int size) {
            if (size < 1 || Integer.bitCount(size) != 1)
                throw new IllegalArgumentException("ring buffer size must be a power of two, got " + size);
            this.ringBufferSize = size;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Calls every module entry point and validates the resulting catalog.
         *
         * @throws GraphConfigurationException if any build error was collected
         * @throws IllegalStateException       if no source was set, or a
         *                                     statement was left without inputs
         */
        public Framework build() {
            if (source == null)
                throw new IllegalStateException("A source is required");
            NodeCatalog catalog = new NodeCatalog();
            for (ModuleEntry entry : modules) {
                try (GraphProxy graph = new GraphProxy(catalog, entry.config())) {
                    entry.module().create(graph, entry.config());
                }
            }
            catalog.validate(externalProducers);
            if (catalog.hasErrors())
                throw new GraphConfigurationException(catalog.errors());

            Map<NodeKind, Integer> counts = catalog.countsByKind();
            log.info("Built graph from {} module(s): {} nodes {}", modules.size(), catalog.size(), counts);
            if (log.isDebugEnabled())
                log.debug("\n{}", new GraphExplain(catalog).dumpTopology());
            return new Framework(this, catalog);
        }
    }
}

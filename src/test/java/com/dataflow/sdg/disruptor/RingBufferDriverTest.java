package com.dataflow.sdg.disruptor;

import com.dataflow.sdg.api.ExecutionSubstrate;
import com.dataflow.sdg.api.NodeFailure;
import com.dataflow.sdg.engine.NodeCatalog;
import com.dataflow.sdg.model.LevelHierarchy;
import com.dataflow.sdg.model.ProductStore;
import com.dataflow.sdg.model.Products;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class RingBufferDriverTest {

    /** Records what reaches the substrate as "data id" / "flush id". */
    private static final class RecordingSubstrate implements ExecutionSubstrate {
        final List<String> received = Collections.synchronizedList(new ArrayList<>());
        volatile boolean failOnFlush;

        @Override
        public void bind(NodeCatalog catalog) {
        }

        @Override
        public void publish(ProductStore store) {
            if (store.isFlush() && failOnFlush)
                throw new IllegalStateException("rejected");
            received.add((store.isFlush() ? "flush " : "data ") + store.id());
        }

        @Override
        public void awaitCompletion() {
        }

        @Override
        public List<NodeFailure> failures() {
            return List.of();
        }

        @Override
        public void shutdown() {
        }
    }

    private RecordingSubstrate substrate;
    private LevelHierarchy hierarchy;
    private RingBufferDriver driver;

    @Before
    public void setUp() {
        substrate = new RecordingSubstrate();
        hierarchy = new LevelHierarchy();
        driver = new RingBufferDriver(substrate, hierarchy, 16);
    }

    @After
    public void tearDown() {
        driver.close();
    }

    @Test
    public void testLeavingAScopeFlushesIt() {
        ProductStore job = ProductStore.base();
        ProductStore run = job.makeChild(0, "run");
        driver.yield(job);
        driver.yield(run);
        driver.yield(run.makeChild(0, "event", "src", Products.of("n", 1)));
        driver.yield(run.makeChild(1, "event", "src", Products.of("n", 2)));
        driver.finish();
        driver.close();

        assertEquals(List.of(
                "data []",
                "data [run:0]",
                "data [run:0, event:0]",
                "flush [run:0, event:0]",
                "data [run:0, event:1]",
                "flush [run:0, event:1]",
                "flush [run:0]",
                "flush []"), substrate.received);
        assertEquals(2, hierarchy.countFor("event"));
        assertEquals(1, hierarchy.countFor("job"));
    }

    @Test
    public void testEmptySourceStillFlushesRoot() {
        driver.finish();
        driver.close();

        assertEquals(List.of("flush []"), substrate.received);
        assertEquals(0, hierarchy.countFor("job"));
    }

    @Test
    public void testMovingToSiblingBranchFlushesDeeperScopes() {
        ProductStore job = ProductStore.base();
        ProductStore run0 = job.makeChild(0, "run");
        ProductStore run1 = job.makeChild(1, "run");
        driver.yield(job);
        driver.yield(run0);
        driver.yield(run0.makeChild(0, "event"));
        driver.yield(run1);
        driver.finish();
        driver.close();

        assertEquals(List.of(
                "data []",
                "data [run:0]",
                "data [run:0, event:0]",
                "flush [run:0, event:0]",
                "flush [run:0]",
                "data [run:1]",
                "flush [run:1]",
                "flush []"), substrate.received);
    }

    @Test
    public void testAncestorsOpenedImplicitly() {
        ProductStore event = ProductStore.base().makeChild(0, "run").makeChild(0, "event");
        driver.yield(event);
        assertEquals(3, driver.depth());
        driver.finish();
        driver.close();

        assertEquals(List.of(
                "data [run:0, event:0]",
                "flush [run:0, event:0]",
                "flush [run:0]",
                "flush []"), substrate.received);
        assertEquals(0, hierarchy.countFor("run"));
        assertEquals(1, hierarchy.countFor("event"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testYieldingOpenScopeAgainRejected() {
        ProductStore job = ProductStore.base();
        driver.yield(job);
        driver.yield(job);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testYieldingFlushRejected() {
        driver.yield(ProductStore.base().makeFlush());
    }

    @Test(expected = IllegalStateException.class)
    public void testYieldAfterFinishRejected() {
        driver.finish();
        driver.yield(ProductStore.base());
    }

    @Test
    public void testPublisherFailureReported() {
        substrate.failOnFlush = true;
        driver.yield(ProductStore.base());
        driver.finish();
        driver.close();
        try {
            driver.checkPublisher();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("rejected", e.getCause().getMessage());
        }
    }
}

package com.dataflow.sdg.disruptor;

import com.dataflow.sdg.api.ExecutionSubstrate;
import com.dataflow.sdg.api.FrameworkDriver;
import com.dataflow.sdg.model.LevelHierarchy;
import com.dataflow.sdg.model.ProductStore;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Framework driver publishing source stores through an LMAX Disruptor ring
 * buffer.
 *
 * <p>
 * The source thread is the single producer; one {@link StorePublisher}
 * consumes the ring and forwards into the substrate. The driver keeps the
 * stack of open scopes: a store that is not inside the innermost open scope
 * closes (flushes) the scopes it leaves, and {@link #finish()} flushes every
 * scope still open, the root last. Ancestors of a yielded store that were
 * never yielded themselves are opened implicitly so their flushes are sent
 * too.
 *
 * <p>
 * Not thread-safe: {@link #yield(ProductStore)} must be called from the
 * source thread only.
 */
@Log4j2
public final class RingBufferDriver implements FrameworkDriver, AutoCloseable {
    private final Disruptor<StoreEvent> disruptor;
    private final RingBuffer<StoreEvent> ringBuffer;
    private final StorePublisher publisher;
    private final LevelHierarchy hierarchy;
    private final Deque<ProductStore> open = new ArrayDeque<>();
    private boolean finished;
    private boolean closed;
    private boolean yielded;

    /**
     * @param bufferSize ring size, a power of two
     */
    public RingBufferDriver(ExecutionSubstrate substrate, LevelHierarchy hierarchy, int bufferSize) {
        this.hierarchy = hierarchy;
        this.publisher = new StorePublisher(substrate);
        this.disruptor = new Disruptor<>(StoreEvent::new, bufferSize, DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE, new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
        this.ringBuffer = disruptor.start();
    }

    @Override
    public void yield(ProductStore store) {
        if (finished)
            throw new IllegalStateException("Driver already finished");
        if (store.isFlush())
            throw new IllegalArgumentException("Sources yield data stores only; flushes are sent by the driver");
        for (ProductStore s : open) {
            if (s.id().equals(store.id()))
                throw new IllegalArgumentException("Scope " + store.id() + " was already yielded");
        }
        checkPublisher();

        while (!open.isEmpty() && !open.peek().id().isAncestorOf(store.id()))
            send(open.pop().makeFlush());

        List<ProductStore> implicit = new ArrayList<>();
        for (ProductStore p = store.parent(); p != null; p = p.parent()) {
            if (!open.isEmpty() && p.id().equals(open.peek().id()))
                break;
            implicit.add(p);
        }
        for (int i = implicit.size() - 1; i >= 0; i--) {
            log.debug("Opening scope {} implicitly", implicit.get(i).id());
            open.push(implicit.get(i));
        }

        hierarchy.incrementCount(store.id());
        send(store);
        open.push(store);
        yielded = true;
    }

    /**
     * Flushes every open scope, innermost first. A source that yielded nothing
     * still gets the root flush so the substrate can complete.
     */
    public void finish() {
        if (finished)
            return;
        finished = true;
        if (!yielded) {
            log.debug("Source yielded no store; flushing the root scope");
            send(ProductStore.base().makeFlush());
        }
        while (!open.isEmpty())
            send(open.pop().makeFlush());
        if (log.isDebugEnabled())
            log.debug("Source finished, ring cursor at {}", ringBuffer.getCursor());
    }

    /** Stops without flushing the open scopes, e.g. after a source failure. */
    public void abort() {
        finished = true;
        open.clear();
        close();
    }

    /** Waits until every yielded store has been forwarded and stops the ring. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
        log.debug("Forwarded {} stores", publisher.forwarded());
    }

    /** @throws IllegalStateException if forwarding a store into the substrate failed */
    public void checkPublisher() {
        RuntimeException error = publisher.error();
        if (error != null)
            throw new IllegalStateException("Publishing into the execution substrate failed", error);
    }

    /** Number of scopes currently open. */
    public int depth() {
        return open.size();
    }

    private void send(ProductStore store) {
        long seq = ringBuffer.next();
        try {
            StoreEvent event = ringBuffer.get(seq);
            event.set(store, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }
}

package com.dataflow.sdg.disruptor;

import com.dataflow.sdg.api.ExecutionSubstrate;
import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor event handler forwarding source stores into the execution
 * substrate.
 *
 * <p>
 * Runs on the single consumer thread of the ring buffer, so stores reach the
 * substrate in exactly the order the source yielded them. That order is what
 * makes a flush arrive after every store of its scope.
 *
 * <p>
 * A failure to publish is kept and stops further forwarding; the driver
 * reports it when the source finishes.
 */
public final class StorePublisher implements EventHandler<StoreEvent> {
    private static final Logger log = LogManager.getLogger(StorePublisher.class);

    private final ExecutionSubstrate substrate;
    private volatile RuntimeException error;
    private long forwarded;

    public StorePublisher(ExecutionSubstrate substrate) {
        this.substrate = substrate;
    }

    @Override
    public void onEvent(StoreEvent event, long sequence, boolean endOfBatch) {
        try {
            if (error == null) {
                substrate.publish(event.store());
                forwarded++;
            }
        } catch (RuntimeException e) {
            log.error("Could not publish store {} (sequence {})", event.store(), event.sequenceId(), e);
            error = e;
        } finally {
            event.clear();
        }
    }

    /** @return the first publishing failure, or null. */
    public RuntimeException error() {
        return error;
    }

    /** Number of stores handed to the substrate; read after the ring is drained. */
    public long forwarded() {
        return forwarded;
    }
}

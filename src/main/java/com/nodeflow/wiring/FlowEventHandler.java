package com.nodeflow.wiring;

import com.nodeflow.api.Node;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.FlowExecutor;

import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Disruptor EventHandler that applies {@link FlowEvent}s to a flow.
 *
 * Runs on the single consumer thread of the ring buffer, which makes that
 * thread the flow's execution context: triggers published from any number of
 * producer threads are applied one after the other through the flow's active
 * executor.
 *
 * Bad events (unknown node index, port out of range, value rejected by the
 * port's type) are logged and dropped; the consumer thread stays alive.
 */
public final class FlowEventHandler implements EventHandler<FlowEvent> {
    private static final Logger log = LogManager.getLogger(FlowEventHandler.class);

    private final Flow flow;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private volatile BatchCallback onBatch;

    public FlowEventHandler(Flow flow) {
        this.flow = flow;
    }

    /** Sets a callback invoked after the last event of every batch. */
    public void setBatchCallback(BatchCallback cb) {
        this.onBatch = cb;
    }

    @Override
    public void onEvent(FlowEvent event, long sequence, boolean endOfBatch) {
        try {
            apply(event);
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            rejected.incrementAndGet();
            log.error("Dropped {} on flow '{}': {}", event, flow.title(), e.getMessage(), e);
        } finally {
            event.clear();
        }

        if (endOfBatch && onBatch != null)
            onBatch.onBatch(sequence, processed.get());
    }

    private void apply(FlowEvent event) {
        List<Node> nodes = flow.nodes();
        int idx = event.nodeIndex();
        if (idx < 0 || idx >= nodes.size())
            throw new IllegalArgumentException("Invalid node index " + idx + " (flow has " + nodes.size() + ")");
        Node node = nodes.get(idx);
        FlowExecutor executor = flow.executor();
        switch (event.kind()) {
            case UPDATE -> executor.updateNode(node, event.port());
            case SET_OUTPUT -> executor.setOutput(node, event.port(), event.value());
            default -> throw new IllegalArgumentException("Event without kind");
        }
    }

    /** Events applied successfully. */
    public long processed() {
        return processed.get();
    }

    /** Events dropped because they could not be applied. */
    public long rejected() {
        return rejected.get();
    }

    /** Callback invoked at the end of every ring buffer batch. */
    @FunctionalInterface
    public interface BatchCallback {
        void onBatch(long sequence, long processedTotal);
    }
}

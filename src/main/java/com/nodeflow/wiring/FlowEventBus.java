package com.nodeflow.wiring;

import com.nodeflow.engine.Flow;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serializes external triggers onto a single consumer thread that drives the
 * flow, through an LMAX Disruptor ring buffer.
 *
 * Producers call {@link #publishUpdate} or {@link #publishOutput} from any
 * thread; the consumer applies the events in sequence order. {@link #close()}
 * waits until every published event was applied.
 */
public final class FlowEventBus implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(FlowEventBus.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Flow flow;
    private final FlowEventHandler handler;
    private final Disruptor<FlowEvent> disruptor;
    private RingBuffer<FlowEvent> ringBuffer;

    public FlowEventBus(Flow flow) {
        this(flow, DEFAULT_BUFFER_SIZE, ProducerType.MULTI);
    }

    /**
     * @param bufferSize   ring size, a power of two
     * @param producerType {@link ProducerType#SINGLE} if only one thread publishes
     */
    public FlowEventBus(Flow flow, int bufferSize, ProducerType producerType) {
        this.flow = flow;
        this.handler = new FlowEventHandler(flow);
        this.disruptor = new Disruptor<>(
                FlowEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                producerType,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
    }

    public synchronized FlowEventBus start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Event bus of flow '" + flow.title() + "' already started");
        ringBuffer = disruptor.start();
        log.info("Event bus started for flow '{}' (buffer size {})", flow.title(), ringBuffer.getBufferSize());
        return this;
    }

    /** Queues an update of node {@code nodeIndex} triggered by {@code input} (-1 for none). */
    public void publishUpdate(int nodeIndex, int input) {
        RingBuffer<FlowEvent> rb = ring();
        long sequence = rb.next();
        try {
            rb.get(sequence).setUpdate(nodeIndex, input, sequence);
        } finally {
            rb.publish(sequence);
        }
    }

    /** Queues setting output {@code output} of node {@code nodeIndex}. */
    public void publishOutput(int nodeIndex, int output, Object value) {
        RingBuffer<FlowEvent> rb = ring();
        long sequence = rb.next();
        try {
            rb.get(sequence).setOutput(nodeIndex, output, value, sequence);
        } finally {
            rb.publish(sequence);
        }
    }

    private RingBuffer<FlowEvent> ring() {
        RingBuffer<FlowEvent> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Event bus of flow '" + flow.title() + "' is not started");
        return rb;
    }

    public FlowEventHandler handler() {
        return handler;
    }

    /** Fill level of the ring buffer in percent. */
    public double backlogPercent() {
        RingBuffer<FlowEvent> rb = ring();
        long total = rb.getBufferSize();
        return (double) (total - rb.remainingCapacity()) / total * 100.0;
    }

    /** Waits until all published events were applied, then stops the consumer. */
    @Override
    public synchronized void close() {
        if (ringBuffer == null)
            return;
        disruptor.shutdown();
        ringBuffer = null;
        log.info("Event bus of flow '{}' stopped after {} events", flow.title(), handler.processed());
    }
}

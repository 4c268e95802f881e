package com.nodeflow.wiring;

/**
 * Mutable trigger carried by the ring buffer of a {@link FlowEventBus}.
 *
 * Instances are pre-allocated by the ring buffer and reused; the consumer
 * clears the value reference once the event was applied.
 *
 * Kinds:
 * - UPDATE: run the update callback of node {@code nodeIndex}, triggered by
 * input {@code port} (-1 for none);
 * - SET_OUTPUT: set output {@code port} of node {@code nodeIndex} to
 * {@code value}.
 */
public final class FlowEvent {
    public enum Kind {
        UPDATE,
        SET_OUTPUT
    }

    private Kind kind;
    private int nodeIndex = -1;
    private int port = -1;
    private Object value;
    private long sequenceId;

    public void setUpdate(int nodeIndex, int input, long seqId) {
        this.kind = Kind.UPDATE;
        this.nodeIndex = nodeIndex;
        this.port = input;
        this.value = null;
        this.sequenceId = seqId;
    }

    public void setOutput(int nodeIndex, int output, Object value, long seqId) {
        this.kind = Kind.SET_OUTPUT;
        this.nodeIndex = nodeIndex;
        this.port = output;
        this.value = value;
        this.sequenceId = seqId;
    }

    public Kind kind() {
        return kind;
    }

    public int nodeIndex() {
        return nodeIndex;
    }

    public int port() {
        return port;
    }

    public Object value() {
        return value;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        kind = null;
        nodeIndex = -1;
        port = -1;
        value = null;
        sequenceId = 0;
    }

    @Override
    public String toString() {
        return "FlowEvent[" + kind + ", node=" + nodeIndex + ", port=" + port + ", seq=" + sequenceId + "]";
    }
}

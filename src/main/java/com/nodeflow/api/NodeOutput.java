package com.nodeflow.api;

/**
 * An output port. Holds the last value set on it.
 *
 * The value is written by the flow's executor only; nodes go through
 * {@code setOutput} so the active executor can apply its propagation rules.
 */
public final class NodeOutput extends NodePort {
    private Object value;

    public NodeOutput(Node node, PortConfig config) {
        super(node, PortDirection.OUTPUT, config);
    }

    public Object value() {
        return value;
    }

    public void store(Object value) {
        this.value = value;
    }

    @Override
    public int index() {
        return node().outputs().indexOf(this);
    }
}

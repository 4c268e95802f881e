package com.nodeflow.api;

/**
 * An input port. Holds the default value read while the input is unconnected.
 */
public final class NodeInput extends NodePort {
    private Object defaultValue;

    public NodeInput(Node node, PortConfig config) {
        super(node, PortDirection.INPUT, config);
        this.defaultValue = config.getDefaultValue();
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public int index() {
        return node().inputs().indexOf(this);
    }
}

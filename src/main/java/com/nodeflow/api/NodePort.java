package com.nodeflow.api;

/**
 * Base class for the connection terminals of a node.
 *
 * A port belongs to exactly one node for its whole life. Its position inside
 * the node's input or output list is its index, which is how ports are
 * addressed by executors and by the structural export.
 */
public abstract class NodePort {
    private final Node node;
    private final PortDirection direction;
    private final PortKind kind;
    private final DataType allowedData;
    private String label;

    protected NodePort(Node node, PortDirection direction, PortConfig config) {
        this.node = node;
        this.direction = direction;
        this.kind = config.getKind();
        this.allowedData = config.getAllowedData();
        this.label = config.getLabel();
    }

    public final Node node() {
        return node;
    }

    public final PortDirection direction() {
        return direction;
    }

    public final PortKind kind() {
        return kind;
    }

    public final boolean isData() {
        return kind == PortKind.DATA;
    }

    /** Declared type, or null if the port accepts anything. */
    public final DataType allowedData() {
        return allowedData;
    }

    public final String label() {
        return label;
    }

    public final void rename(String label) {
        this.label = label == null ? "" : label;
    }

    /** Current index of this port on its node, or -1 if it was deleted. */
    public abstract int index();

    @Override
    public String toString() {
        return node.title() + (direction == PortDirection.INPUT ? ".in[" : ".out[") + index() + "]";
    }
}

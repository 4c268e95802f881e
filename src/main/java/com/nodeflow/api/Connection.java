package com.nodeflow.api;

import java.util.Objects;

/**
 * A directed edge from an output port to an input port.
 */
public final class Connection {
    private final NodeOutput out;
    private final NodeInput in;

    public Connection(NodeOutput out, NodeInput in) {
        this.out = Objects.requireNonNull(out, "out");
        this.in = Objects.requireNonNull(in, "in");
    }

    public NodeOutput out() {
        return out;
    }

    public NodeInput in() {
        return in;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Connection c))
            return false;
        return out == c.out && in == c.in;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(out) + System.identityHashCode(in);
    }

    @Override
    public String toString() {
        return out + " -> " + in;
    }
}

package com.nodeflow.api;

/**
 * A connection expressed purely through indices, the form in which an external
 * persistence layer stores it.
 *
 * Node indices refer to the flow's node order at the time of export, port
 * indices to the positions of the ports on their nodes.
 */
public final class ConnectionInfo {
    private final int sourceNode;
    private final int sourcePort;
    private final int targetNode;
    private final int targetPort;

    public ConnectionInfo(int sourceNode, int sourcePort, int targetNode, int targetPort) {
        this.sourceNode = sourceNode;
        this.sourcePort = sourcePort;
        this.targetNode = targetNode;
        this.targetPort = targetPort;
    }

    public int sourceNode() {
        return sourceNode;
    }

    public int sourcePort() {
        return sourcePort;
    }

    public int targetNode() {
        return targetNode;
    }

    public int targetPort() {
        return targetPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConnectionInfo c))
            return false;
        return sourceNode == c.sourceNode && sourcePort == c.sourcePort
                && targetNode == c.targetNode && targetPort == c.targetPort;
    }

    @Override
    public int hashCode() {
        int h = sourceNode;
        h = 31 * h + sourcePort;
        h = 31 * h + targetNode;
        return 31 * h + targetPort;
    }

    @Override
    public String toString() {
        return "(" + sourceNode + ", " + sourcePort + ", " + targetNode + ", " + targetPort + ")";
    }
}

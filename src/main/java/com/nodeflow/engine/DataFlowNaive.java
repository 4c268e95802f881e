package com.nodeflow.engine;

import com.nodeflow.api.*;

import java.util.List;

/**
 * Push-based data flow, depth-first.
 *
 * Setting an output immediately updates every connected node, in connection
 * order, before the call returns. Adding or removing a data connection updates
 * the target node on the affected input so it sees the new value.
 *
 * A node reachable through several paths is updated once per path: in a
 * diamond the sink runs twice for one source change. {@link DataFlowOptimized}
 * removes that redundancy.
 */
public class DataFlowNaive extends FlowExecutor {

    public DataFlowNaive(Flow flow) {
        super(flow);
    }

    @Override
    public FlowAlg algorithm() {
        return FlowAlg.DATA;
    }

    @Override
    public void setOutput(Node node, int index, Object value) {
        push(storeOutput(node, index, value));
    }

    @Override
    public void execOutput(Node node, int index) {
        push(execPort(node, index));
    }

    private void push(NodeOutput out) {
        // Snapshot: callbacks may rewire the flow.
        List<NodeInput> targets = List.copyOf(flow.connectedInputs(out));
        if (targets.isEmpty())
            return;
        beginExecution();
        try {
            for (NodeInput in : targets) {
                activate(new Connection(out, in));
                invoke(in.node(), in.index());
            }
        } finally {
            endExecution();
        }
    }

    @Override
    public void connAdded(Connection connection, boolean silent) {
        refresh(connection, silent);
    }

    @Override
    public void connRemoved(Connection connection, boolean silent) {
        refresh(connection, silent);
    }

    private void refresh(Connection connection, boolean silent) {
        if (silent || !connection.in().isData())
            return;
        updateNode(connection.in().node(), connection.in().index());
    }
}

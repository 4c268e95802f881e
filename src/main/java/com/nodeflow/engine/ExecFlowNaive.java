package com.nodeflow.engine;

import com.nodeflow.api.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Control flow executor.
 *
 * Firing an exec output runs every connected node depth-first before the call
 * returns. Data is pulled: reading a connected data input first updates the
 * node that owns the connected output, then returns that output's value.
 * Setting a data output only stores the value.
 *
 * Pulls are guarded. A node that, directly or indirectly, pulls from a node
 * still waiting on its own pull, or a pull chain deeper than the configured
 * limit, raises {@link ExecutionCycleException} inside the requesting callback.
 */
public class ExecFlowNaive extends FlowExecutor {
    public static final int DEFAULT_MAX_PULL_DEPTH = 1024;

    private final int maxPullDepth;
    private final Set<Node> pulling = new HashSet<>();
    private int pullDepth;

    public ExecFlowNaive(Flow flow) {
        this(flow, DEFAULT_MAX_PULL_DEPTH);
    }

    public ExecFlowNaive(Flow flow, int maxPullDepth) {
        super(flow);
        if (maxPullDepth < 1)
            throw new IllegalArgumentException("maxPullDepth must be positive: " + maxPullDepth);
        this.maxPullDepth = maxPullDepth;
    }

    @Override
    public FlowAlg algorithm() {
        return FlowAlg.EXEC;
    }

    @Override
    public Object input(Node node, int index) {
        NodeInput in = dataInput(node, index);
        NodeOutput src = flow.connectedOutput(in);
        if (src == null)
            return in.defaultValue();

        Node pred = src.node();
        if (pulling.contains(pred))
            throw new ExecutionCycleException("Cyclic data pull: '" + node.title() + "' requested data from '"
                    + pred.title() + "' which is waiting on its own request");
        if (pullDepth >= maxPullDepth)
            throw new ExecutionCycleException("Data pull chain exceeds " + maxPullDepth + " nodes at '"
                    + node.title() + "'");

        boolean added = pulling.add(node);
        pullDepth++;
        beginExecution();
        try {
            activate(new Connection(src, in));
            invoke(pred, -1);
        } finally {
            endExecution();
            pullDepth--;
            if (added)
                pulling.remove(node);
        }
        return src.value();
    }

    @Override
    public void setOutput(Node node, int index, Object value) {
        storeOutput(node, index, value);
    }

    @Override
    public void execOutput(Node node, int index) {
        NodeOutput out = execPort(node, index);
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

    public int maxPullDepth() {
        return maxPullDepth;
    }
}

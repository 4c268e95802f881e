package com.nodeflow.engine;

import com.nodeflow.api.FlowAlg;
import com.nodeflow.api.Node;
import com.nodeflow.api.NodeInput;
import com.nodeflow.api.NodeOutput;

import java.util.HashSet;
import java.util.Set;

/**
 * Executor that propagates nothing on its own.
 *
 * Setting or firing an output only records it as updated. An external driver,
 * usually a player, asks which inputs see fresh data and decides itself which
 * nodes to run, then clears the records.
 */
public class ManualFlow extends FlowExecutor {
    private final Set<NodeOutput> updated = new HashSet<>();

    public ManualFlow(Flow flow) {
        super(flow);
    }

    @Override
    public FlowAlg algorithm() {
        return FlowAlg.MANUAL;
    }

    @Override
    public void setOutput(Node node, int index, Object value) {
        updated.add(storeOutput(node, index, value));
    }

    @Override
    public void execOutput(Node node, int index) {
        updated.add(execPort(node, index));
    }

    /** True if the output connected to this input was updated since the last clear. */
    public boolean shouldInputUpdate(NodeInput in) {
        NodeOutput src = flow.connectedOutput(in);
        return src != null && updated.contains(src);
    }

    public boolean hasUpdatedOutputs(Node node) {
        for (NodeOutput out : node.outputs()) {
            if (updated.contains(out))
                return true;
        }
        return false;
    }

    public boolean isUpdated(NodeOutput out) {
        return updated.contains(out);
    }

    public void clearUpdates() {
        updated.clear();
    }

    /** Runs the driver's pass as one execution; node updates inside it join that execution. */
    public void execute(Runnable pass) {
        beginExecution();
        try {
            pass.run();
        } finally {
            endExecution();
        }
    }
}

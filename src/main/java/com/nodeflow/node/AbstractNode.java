package com.nodeflow.node;

import com.nodeflow.api.*;
import com.nodeflow.engine.Flow;

import java.util.*;

/**
 * Base class for concrete nodes.
 *
 * Holds identity and ports and routes every data access through the flow's
 * active executor, so the same node works unchanged in every algorithm mode.
 *
 * <h3>Ports</h3>
 * <p>
 * Static ports are declared in the constructor; more can be created and
 * deleted at runtime. Deleting a port first disconnects it.
 *
 * <h3>Blocking</h3>
 * <p>
 * While {@link #setBlockUpdates(boolean) blocked}, {@link #update(int)}
 * requests are dropped. Used to suppress the cascade of updates while a node
 * is being reconfigured.
 */
public abstract class AbstractNode implements Node {
    protected final Flow flow;

    private final long id;
    private final String identifier;
    private String title;
    private long previousId = -1;
    private boolean blockUpdates;

    private final List<NodeInput> inputs = new ArrayList<>();
    private final List<NodeOutput> outputs = new ArrayList<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();

    protected AbstractNode(Flow flow, String title, List<PortConfig> initInputs, List<PortConfig> initOutputs) {
        this.flow = Objects.requireNonNull(flow, "flow");
        this.id = flow.ids().next();
        this.identifier = getClass().getSimpleName();
        this.title = title;
        for (PortConfig c : initInputs)
            inputs.add(new NodeInput(this, c));
        for (PortConfig c : initOutputs)
            outputs.add(new NodeOutput(this, c));
    }

    @Override
    public final long id() {
        return id;
    }

    @Override
    public String identifier() {
        return identifier;
    }

    @Override
    public String title() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    /** Id this node carried in the flow it was loaded from, or -1. */
    public long previousId() {
        return previousId;
    }

    public void setPreviousId(long previousId) {
        this.previousId = previousId;
    }

    public Flow flow() {
        return flow;
    }

    @Override
    public List<NodeInput> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public List<NodeOutput> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    @Override
    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    protected void setProperty(String key, Object value) {
        properties.put(key, value);
    }

    // -------------------------------------------------------------------------
    // Data access, all through the executor
    // -------------------------------------------------------------------------

    /** Value seen at a data input. */
    public Object input(int index) {
        return flow.executor().input(this, index);
    }

    public void setOutput(int index, Object value) {
        flow.executor().setOutput(this, index, value);
    }

    public void execOutput(int index) {
        flow.executor().execOutput(this, index);
    }

    /** Requests an update through the executor, which decides how it propagates. */
    public void update() {
        update(-1);
    }

    public void update(int input) {
        if (blockUpdates)
            return;
        flow.executor().updateNode(this, input);
    }

    public boolean isBlockingUpdates() {
        return blockUpdates;
    }

    public void setBlockUpdates(boolean block) {
        this.blockUpdates = block;
    }

    // -------------------------------------------------------------------------
    // Runtime ports
    // -------------------------------------------------------------------------

    public NodeInput createInput(PortConfig config) {
        return createInput(config, -1);
    }

    /** @param insert position of the new port, or -1 to append */
    public NodeInput createInput(PortConfig config, int insert) {
        NodeInput in = new NodeInput(this, config);
        inputs.add(insert < 0 ? inputs.size() : insert, in);
        try {
            flow.portAdded(in);
        } catch (IllegalStateException e) {
            inputs.remove(in);
            throw e;
        }
        return in;
    }

    public NodeOutput createOutput(PortConfig config) {
        return createOutput(config, -1);
    }

    public NodeOutput createOutput(PortConfig config, int insert) {
        NodeOutput out = new NodeOutput(this, config);
        outputs.add(insert < 0 ? outputs.size() : insert, out);
        try {
            flow.portAdded(out);
        } catch (IllegalStateException e) {
            outputs.remove(out);
            throw e;
        }
        return out;
    }

    /** Disconnects and deletes an input. */
    public void deleteInput(int index) {
        NodeInput in = inputs.get(index);
        flow.disconnectPort(in);
        inputs.remove(index);
        flow.portRemoved(in);
    }

    public void deleteOutput(int index) {
        NodeOutput out = outputs.get(index);
        flow.disconnectPort(out);
        outputs.remove(index);
        flow.portRemoved(out);
    }

    public void renameInput(int index, String label) {
        inputs.get(index).rename(label);
    }

    public void renameOutput(int index, String label) {
        outputs.get(index).rename(label);
    }

    @Override
    public String toString() {
        return identifier + "[" + id + ", " + title + "]";
    }
}

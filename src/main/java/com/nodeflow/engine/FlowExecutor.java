package com.nodeflow.engine;

import com.nodeflow.api.*;
import com.nodeflow.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class of the strategies that decide when node callbacks run.
 *
 * Every flow holds exactly one executor. Nodes never talk to each other
 * directly: reading an input, setting an output, triggering an exec output and
 * requesting an update all go through the executor, which applies its
 * propagation rules.
 *
 * Executions:
 * A top-level call into the executor (an explicit update, a set output, an
 * exec trigger) opens an execution; nested calls made from node callbacks
 * join it. Listeners see one start and one end per top-level call.
 *
 * Error Isolation:
 * Exceptions thrown by a node callback never escape the executor. They are
 * logged (rate-limited, as failing nodes tend to fail again on every frame)
 * and reported through {@link FlowListener#onNodeError}. The graph stays
 * usable and other nodes keep running.
 */
public abstract class FlowExecutor {
    private static final Logger log = LogManager.getLogger(FlowExecutor.class);

    private final ErrorRateLimiter errorLog = new ErrorRateLimiter(log, 1000);

    protected final Flow flow;

    private int depth;
    private long execution;
    private int nodesUpdated;

    protected FlowExecutor(Flow flow) {
        this.flow = flow;
    }

    public final Flow flow() {
        return flow;
    }

    public abstract FlowAlg algorithm();

    /**
     * Runs the node's update callback.
     *
     * @param input index of the triggering input, or -1
     */
    public void updateNode(Node node, int input) {
        beginExecution();
        try {
            invoke(node, input);
        } finally {
            endExecution();
        }
    }

    /**
     * Returns the data currently seen at a data input: the connected output's
     * value, or the input's default when it is unconnected.
     */
    public Object input(Node node, int index) {
        return readInput(dataInput(node, index));
    }

    /** Stores a value on a data output and applies this executor's propagation rule. */
    public abstract void setOutput(Node node, int index, Object value);

    /** Fires an exec output. */
    public abstract void execOutput(Node node, int index);

    /** Called after a connection was added. {@code silent} suppresses any reaction. */
    public void connAdded(Connection connection, boolean silent) {
    }

    /** Called after a connection was removed. {@code silent} suppresses any reaction. */
    public void connRemoved(Connection connection, boolean silent) {
    }

    /** Called on every structural change of the flow. */
    public void flowChanged() {
    }

    public final boolean isExecuting() {
        return depth > 0;
    }

    /** Number of executions opened so far. */
    public final long executionCount() {
        return execution;
    }

    protected final void beginExecution() {
        if (depth++ == 0) {
            execution++;
            nodesUpdated = 0;
            flow.listener().onExecutionStart(execution, algorithm());
        }
    }

    protected final void endExecution() {
        if (--depth == 0)
            flow.listener().onExecutionEnd(execution, nodesUpdated);
    }

    /**
     * Calls the node's update callback inside the current execution.
     *
     * @return false if the callback threw
     */
    protected final boolean invoke(Node node, int input) {
        long start = System.nanoTime();
        try {
            node.updateEvent(input);
        } catch (Exception e) {
            errorLog.log("Node '" + node.title() + "' failed on input " + input, e);
            flow.listener().onNodeError(execution, node, input, e);
            return false;
        }
        nodesUpdated++;
        flow.listener().onNodeUpdated(execution, node, input, System.nanoTime() - start);
        return true;
    }

    /** Marks a connection as carrying data or control in the current execution. */
    protected final void activate(Connection connection) {
        flow.listener().onConnectionActivated(execution, connection);
    }

    /**
     * Type-checks the value and stores it on the output.
     *
     * @throws IllegalArgumentException if the output is an exec output or the
     *                                  value does not fit its declared type
     */
    protected final NodeOutput storeOutput(Node node, int index, Object value) {
        NodeOutput out = node.outputs().get(index);
        if (!out.isData())
            throw new IllegalArgumentException("Cannot set a value on exec output " + out);
        if (!flow.types().accepts(out.allowedData(), value))
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                    + " does not fit " + out + " declared as " + out.allowedData());
        out.store(value);
        return out;
    }

    protected final NodeOutput execPort(Node node, int index) {
        NodeOutput out = node.outputs().get(index);
        if (out.isData())
            throw new IllegalArgumentException("Cannot fire data output " + out);
        return out;
    }

    protected final NodeInput dataInput(Node node, int index) {
        NodeInput in = node.inputs().get(index);
        if (!in.isData())
            throw new IllegalArgumentException("Cannot read a value from exec input " + in);
        return in;
    }

    protected final Object readInput(NodeInput in) {
        NodeOutput src = flow.connectedOutput(in);
        return src != null ? src.value() : in.defaultValue();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + flow.title() + "]";
    }
}

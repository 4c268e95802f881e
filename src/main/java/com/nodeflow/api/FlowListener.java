package com.nodeflow.api;

/**
 * Observability interface for monitoring flow executions.
 *
 * Implementations can be registered with a flow to receive callbacks from the
 * active executor. This is the primary mechanism for:
 *
 * - Profiling: measuring how long node callbacks take.
 * - Debugging: tracing which nodes run in a given execution and which
 * connections carried data.
 * - Error reporting: node callback failures are caught at the executor
 * boundary and surface here instead of aborting the execution.
 *
 * An execution starts with the first top-level trigger (a node update, an
 * output set, an exec signal) and ends when that trigger returns. Nested
 * triggers made from inside node callbacks belong to the same execution.
 *
 * Performance Warning:
 * These callbacks run on the execution path. Keep implementations light.
 */
public interface FlowListener {

    /**
     * Called when a top-level trigger starts a new execution.
     *
     * @param execution incrementing execution number of the executor
     * @param algorithm algorithm mode of the executor running it
     */
    void onExecutionStart(long execution, FlowAlg algorithm);

    /**
     * Called after a node's update callback returned normally.
     *
     * @param execution     current execution number
     * @param node          the node that ran
     * @param input         trigger input index, -1 if none
     * @param durationNanos wall time spent in the callback
     */
    void onNodeUpdated(long execution, Node node, int input, long durationNanos);

    /**
     * Called when a node's callback threw. The execution carries on.
     *
     * @param execution current execution number
     * @param node      the failing node
     * @param input     trigger input index, -1 if none
     * @param error     the exception thrown by the node
     */
    void onNodeError(long execution, Node node, int input, Throwable error);

    /**
     * Called every time a connection delivers data or a trigger to its input.
     *
     * @param execution current execution number
     * @param connection the activated connection
     */
    void onConnectionActivated(long execution, Connection connection);

    /**
     * Called when the execution's top-level trigger returns.
     *
     * @param execution    current execution number
     * @param nodesUpdated number of node callbacks run in this execution
     */
    void onExecutionEnd(long execution, int nodesUpdated);
}

package com.nodeflow.engine;

/**
 * Raised when an execution would have to traverse a cycle it cannot resolve:
 * a cycle reachable from a DataFlowOptimized trigger, a player pass over a
 * cyclic active subgraph, or a re-entrant data pull in exec mode.
 */
public class ExecutionCycleException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public ExecutionCycleException(String message) {
        super(message);
    }
}

package com.nodeflow.util;

import com.nodeflow.api.Connection;
import com.nodeflow.api.FlowAlg;
import com.nodeflow.api.FlowListener;
import com.nodeflow.api.Node;

import java.util.HashMap;
import java.util.Map;

/**
 * Counts connection activations, both in total and within the most recent
 * execution.
 */
public final class ActivationCounter implements FlowListener {
    private final Map<Connection, Integer> total = new HashMap<>();
    private final Map<Connection, Integer> lastExecution = new HashMap<>();
    private int maxPerExecution;

    @Override
    public synchronized void onExecutionStart(long execution, FlowAlg algorithm) {
        lastExecution.clear();
    }

    @Override
    public void onNodeUpdated(long execution, Node node, int input, long durationNanos) {
        // No-op
    }

    @Override
    public void onNodeError(long execution, Node node, int input, Throwable error) {
        // No-op
    }

    @Override
    public synchronized void onConnectionActivated(long execution, Connection connection) {
        total.merge(connection, 1, Integer::sum);
        int n = lastExecution.merge(connection, 1, Integer::sum);
        if (n > maxPerExecution)
            maxPerExecution = n;
    }

    @Override
    public void onExecutionEnd(long execution, int nodesUpdated) {
        // No-op
    }

    public synchronized int total(Connection connection) {
        return total.getOrDefault(connection, 0);
    }

    /** Activations of the connection in the current or most recent execution. */
    public synchronized int inLastExecution(Connection connection) {
        return lastExecution.getOrDefault(connection, 0);
    }

    /** Highest number of times any single connection fired within one execution. */
    public synchronized int maxPerExecution() {
        return maxPerExecution;
    }

    public synchronized void reset() {
        total.clear();
        lastExecution.clear();
        maxPerExecution = 0;
    }
}

package com.nodeflow.util;

import com.nodeflow.api.Connection;
import com.nodeflow.api.FlowAlg;
import com.nodeflow.api.FlowListener;
import com.nodeflow.api.Node;

import java.util.Arrays;

/**
 * Fans {@link FlowListener} callbacks out to any number of listeners.
 *
 * Every flow owns one of these; listeners added to the flow end up here. The
 * array is replaced on modification so iteration needs no lock.
 */
public final class CompositeFlowListener implements FlowListener {
    private volatile FlowListener[] listeners = new FlowListener[0];

    public synchronized void add(FlowListener listener) {
        FlowListener[] old = listeners;
        FlowListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(FlowListener listener) {
        FlowListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                FlowListener[] next = new FlowListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onExecutionStart(long execution, FlowAlg algorithm) {
        for (FlowListener l : listeners)
            l.onExecutionStart(execution, algorithm);
    }

    @Override
    public void onNodeUpdated(long execution, Node node, int input, long durationNanos) {
        for (FlowListener l : listeners)
            l.onNodeUpdated(execution, node, input, durationNanos);
    }

    @Override
    public void onNodeError(long execution, Node node, int input, Throwable error) {
        for (FlowListener l : listeners)
            l.onNodeError(execution, node, input, error);
    }

    @Override
    public void onConnectionActivated(long execution, Connection connection) {
        for (FlowListener l : listeners)
            l.onConnectionActivated(execution, connection);
    }

    @Override
    public void onExecutionEnd(long execution, int nodesUpdated) {
        for (FlowListener l : listeners)
            l.onExecutionEnd(execution, nodesUpdated);
    }
}

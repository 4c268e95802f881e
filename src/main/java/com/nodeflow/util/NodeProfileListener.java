package com.nodeflow.util;

import com.nodeflow.api.Connection;
import com.nodeflow.api.FlowAlg;
import com.nodeflow.api.FlowListener;
import com.nodeflow.api.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregates update counts, errors and callback durations per node. */
public class NodeProfileListener implements FlowListener {

    public static class NodeStats {
        public final String title;
        public long updates;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;

        public NodeStats(String title) {
            this.title = title;
        }

        void update(long duration) {
            updates++;
            totalDurationNanos += duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return updates == 0 ? 0 : totalDurationNanos / (double) updates / 1000.0;
        }
    }

    private final Map<Long, NodeStats> stats = new LinkedHashMap<>();
    private long executions;

    @Override
    public synchronized void onExecutionStart(long execution, FlowAlg algorithm) {
        executions++;
    }

    @Override
    public synchronized void onNodeUpdated(long execution, Node node, int input, long durationNanos) {
        statsFor(node).update(durationNanos);
    }

    @Override
    public synchronized void onNodeError(long execution, Node node, int input, Throwable error) {
        statsFor(node).errors++;
    }

    @Override
    public void onConnectionActivated(long execution, Connection connection) {
        // No-op
    }

    @Override
    public void onExecutionEnd(long execution, int nodesUpdated) {
        // No-op
    }

    private NodeStats statsFor(Node node) {
        return stats.computeIfAbsent(node.id(), id -> new NodeStats(node.title()));
    }

    /** Number of successful updates of the node, 0 if it never ran. */
    public synchronized long updates(Node node) {
        NodeStats s = stats.get(node.id());
        return s == null ? 0 : s.updates;
    }

    public synchronized long errors(Node node) {
        NodeStats s = stats.get(node.id());
        return s == null ? 0 : s.errors;
    }

    public synchronized long executions() {
        return executions;
    }

    public synchronized void reset() {
        stats.clear();
        executions = 0;
    }

    /** Returns a formatted table of node statistics, most expensive first. */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %10s | %8s | %10s | %10s | %10s%n", "Node", "Updates", "Errors",
                "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("-----------------------------------------------------------------------------------------\n");

        List<NodeStats> rows = new ArrayList<>(stats.values());
        rows.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));
        for (NodeStats s : rows) {
            sb.append(String.format("%-30s | %10d | %8d | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.title, 30),
                    s.updates,
                    s.errors,
                    s.avgMicros(),
                    s.updates == 0 ? 0.0 : s.minDurationNanos / 1000.0,
                    s.updates == 0 ? 0.0 : s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}

package com.nodeflow.node;

import com.nodeflow.api.*;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.TypeRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Small nodes and listeners shared by the tests. */
public final class NodeFixtures {
    private NodeFixtures() {
    }

    private static List<PortConfig> data(int n) {
        List<PortConfig> l = new ArrayList<>();
        for (int i = 0; i < n; i++)
            l.add(PortConfig.data("in" + i));
        return l;
    }

    /** Sink recording the trigger index of every update. */
    public static class Recorder extends AbstractNode {
        public final List<Integer> triggers = new ArrayList<>();

        public Recorder(Flow flow, int inputs) {
            super(flow, "recorder", data(inputs), List.of());
        }

        @Override
        public void updateEvent(int input) {
            triggers.add(input);
        }
    }

    /** Forwards its input only while open. */
    public static class Gate extends AbstractNode {
        public boolean open;

        public Gate(Flow flow) {
            super(flow, "gate", data(1), List.of(PortConfig.data("out")));
        }

        @Override
        public void updateEvent(int input) {
            if (open)
                setOutput(0, input(0));
        }
    }

    /** Always throws. */
    public static class Failing extends AbstractNode {
        public Failing(Flow flow) {
            super(flow, "failing", data(1), List.of(PortConfig.data("out")));
        }

        @Override
        public void updateEvent(int input) {
            throw new IllegalStateException("boom");
        }
    }

    /** Copies its input to its output. */
    public static class Pass extends AbstractNode {
        public int updates;

        public Pass(Flow flow, String title) {
            super(flow, title, data(1), List.of(PortConfig.data("out")));
        }

        @Override
        public void updateEvent(int input) {
            updates++;
            setOutput(0, input(0));
        }
    }

    /** Counts lifecycle hook calls. */
    public static class Hooks extends AbstractNode {
        public volatile int inits, pauses, stops, updates;

        public Hooks(Flow flow) {
            super(flow, "hooks", data(1), List.of());
        }

        @Override
        public void updateEvent(int input) {
            updates++;
        }

        @Override
        public void init() {
            inits++;
        }

        @Override
        public void pause() {
            pauses++;
        }

        @Override
        public void stop() {
            stops++;
        }
    }

    /** Sink accepting strings only. */
    public static class StringSink extends AbstractNode {
        public StringSink(Flow flow) {
            super(flow, "strings", List.of(PortConfig.data("s", TypeRegistry.STRING)), List.of());
        }

        @Override
        public void updateEvent(int input) {
        }
    }

    /** Sink accepting any number. */
    public static class NumberSink extends AbstractNode {
        public NumberSink(Flow flow) {
            super(flow, "numbers", List.of(PortConfig.data("n", TypeRegistry.NUMBER)), List.of());
        }

        @Override
        public void updateEvent(int input) {
        }
    }

    /** Collects node errors reported by executors and players. */
    public static class ErrorCollector implements FlowListener {
        public final List<Node> nodes = Collections.synchronizedList(new ArrayList<>());
        public final List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onExecutionStart(long execution, FlowAlg algorithm) {
        }

        @Override
        public void onNodeUpdated(long execution, Node node, int input, long durationNanos) {
        }

        @Override
        public void onNodeError(long execution, Node node, int input, Throwable error) {
            nodes.add(node);
            errors.add(error);
        }

        @Override
        public void onConnectionActivated(long execution, Connection connection) {
        }

        @Override
        public void onExecutionEnd(long execution, int nodesUpdated) {
        }
    }
}

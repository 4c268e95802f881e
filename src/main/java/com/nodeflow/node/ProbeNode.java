package com.nodeflow.node;

import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Sink that records what it sees on its input.
 *
 * Keeps the last value, the number of updates and the full history. An
 * optional observer is called with every value.
 */
public class ProbeNode extends AbstractNode {
    private final List<Object> history = new ArrayList<>();
    private Object last;
    private int updates;
    private Consumer<Object> observer;

    public ProbeNode(Flow flow) {
        this(flow, "probe");
    }

    public ProbeNode(Flow flow, String title) {
        super(flow, title, List.of(PortConfig.data("in")), List.of());
    }

    public ProbeNode onValue(Consumer<Object> observer) {
        this.observer = observer;
        return this;
    }

    @Override
    public void updateEvent(int input) {
        last = input(0);
        updates++;
        history.add(last);
        if (observer != null)
            observer.accept(last);
    }

    public Object last() {
        return last;
    }

    public int updates() {
        return updates;
    }

    public List<Object> history() {
        return history;
    }

    public void reset() {
        history.clear();
        last = null;
        updates = 0;
    }
}

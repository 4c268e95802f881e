package com.nodeflow.node;

import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;

import java.util.List;
import java.util.Map;

/**
 * Source node holding a constant. Every update emits the constant on its only
 * output.
 */
public class ValueNode extends AbstractNode {
    public static final String VALUE = "value";

    public ValueNode(Flow flow) {
        this(flow, null);
    }

    public ValueNode(Flow flow, Object value) {
        super(flow, "value", List.of(), List.of(PortConfig.data("value")));
        setProperty(VALUE, value);
    }

    /** Creates the node from persisted properties. */
    public static ValueNode fromProperties(Flow flow, Map<String, Object> properties) {
        return new ValueNode(flow, properties.get(VALUE));
    }

    public Object value() {
        return properties().get(VALUE);
    }

    /** Replaces the constant and emits it. */
    public void setValue(Object value) {
        setProperty(VALUE, value);
        update();
    }

    @Override
    public void updateEvent(int input) {
        setOutput(0, value());
    }
}

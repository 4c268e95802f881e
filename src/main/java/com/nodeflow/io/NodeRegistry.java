package com.nodeflow.io;

import com.nodeflow.api.Node;
import com.nodeflow.engine.Flow;
import com.nodeflow.node.ActionNode;
import com.nodeflow.node.CounterFrameNode;
import com.nodeflow.node.ProbeNode;
import com.nodeflow.node.SumNode;
import com.nodeflow.node.ValueNode;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry mapping node type identifiers to factories, used to re-create nodes
 * when a flow definition is loaded.
 */
public final class NodeRegistry {

    /** Creates a node for a flow from its persisted properties. */
    @FunctionalInterface
    public interface Creator {
        Node create(Flow flow, Map<String, Object> properties);
    }

    private final Map<String, Creator> registry = new ConcurrentHashMap<>();

    public NodeRegistry() {
        registerBuiltIns();
    }

    /**
     * @throws IllegalArgumentException if the identifier is already taken
     */
    public NodeRegistry register(String identifier, Creator creator) {
        if (registry.putIfAbsent(identifier, creator) != null)
            throw new IllegalArgumentException("Node type already registered: " + identifier);
        return this;
    }

    /** Registers under the class' simple name, the default {@link Node#identifier()}. */
    public NodeRegistry register(Class<? extends Node> type, Creator creator) {
        return register(type.getSimpleName(), creator);
    }

    public boolean contains(String identifier) {
        return registry.containsKey(identifier);
    }

    public Set<String> identifiers() {
        return new TreeSet<>(registry.keySet());
    }

    /**
     * @throws IllegalArgumentException for unknown identifiers
     */
    public Node create(String identifier, Flow flow, Map<String, Object> properties) {
        Creator c = registry.get(identifier);
        if (c == null)
            throw new IllegalArgumentException("Unknown node type: " + identifier);
        return c.create(flow, properties == null ? Map.of() : properties);
    }

    // ── Built-in Factories ──────────────────────────────────────────

    private void registerBuiltIns() {
        register(ValueNode.class, ValueNode::fromProperties);
        register(SumNode.class, SumNode::fromProperties);
        register(CounterFrameNode.class, CounterFrameNode::fromProperties);
        register(ProbeNode.class, (flow, props) -> new ProbeNode(flow));
        register(ActionNode.class, (flow, props) -> new ActionNode(flow));
    }
}

package com.nodeflow.io;

import com.nodeflow.api.*;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.TypeRegistry;
import com.nodeflow.node.AbstractNode;
import com.nodeflow.util.IdCounter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-creates flows from {@link FlowDefinition}s.
 *
 * Nodes are built through the {@link NodeRegistry} and receive fresh ids from
 * the flow's {@link IdCounter}; the id a node had at export time is kept as its
 * previous id and the returned remap table maps it to the new node.
 * Connections are restored silently, so no executor reacts while loading.
 */
public final class FlowLoader {
    private static final Logger log = LogManager.getLogger(FlowLoader.class);

    /** A loaded flow with its old id to node table. */
    public record LoadResult(Flow flow, Map<Long, Node> remap) {
    }

    private final NodeRegistry registry;
    private final TypeRegistry types;

    public FlowLoader(NodeRegistry registry) {
        this(registry, new TypeRegistry());
    }

    public FlowLoader(NodeRegistry registry, TypeRegistry types) {
        this.registry = registry;
        this.types = types;
    }

    /** Builds a new flow, using the definition's title unless one is given. */
    public LoadResult load(FlowDefinition def, String title, IdCounter ids) {
        Flow flow = new Flow(title != null ? title : def.getTitle(), ids, types);
        Map<Long, Node> remap = loadInto(flow, def);
        if (def.getAlgorithmMode() != null)
            flow.setAlgorithmMode(def.getAlgorithmMode());
        return new LoadResult(flow, remap);
    }

    /**
     * Appends the definition's nodes and connections to an existing flow.
     *
     * @return old id to new node
     * @throws IllegalArgumentException for unknown node types or connections
     *                                  pointing outside the definition
     */
    public Map<Long, Node> loadInto(Flow flow, FlowDefinition def) {
        List<FlowDefinition.NodeDef> defs = def.getNodes() == null ? List.of() : def.getNodes();
        List<Node> created = new ArrayList<>(defs.size());
        Map<Long, Node> remap = new LinkedHashMap<>();

        for (FlowDefinition.NodeDef nd : defs) {
            Node node = registry.create(nd.getIdentifier(), flow, nd.getProperties());
            if (node instanceof AbstractNode an) {
                if (nd.getTitle() != null)
                    an.setTitle(nd.getTitle());
                an.setPreviousId(nd.getId());
                syncInputs(an, nd.getInputs());
                syncOutputs(an, nd.getOutputs());
            } else {
                requireSize(node, "inputs", node.inputs().size(), nd.getInputs());
                requireSize(node, "outputs", node.outputs().size(), nd.getOutputs());
            }
            flow.nodeCreated.emit(node);
            flow.addNode(node);
            created.add(node);
            remap.put(nd.getId(), node);
        }

        if (def.getConnections() != null) {
            for (FlowDefinition.ConnectionDef c : def.getConnections()) {
                Node from = nodeAt(created, c.getParentNodeIndex());
                Node to = nodeAt(created, c.getConnectedNodeIndex());
                NodeOutput out = portAt(from.outputs(), c.getOutputPortIndex(), from);
                NodeInput in = portAt(to.inputs(), c.getConnectedInputPortIndex(), to);
                ConnValidType v = flow.connectPorts(out, in, true);
                if (v != ConnValidType.VALID)
                    log.warn("Skipped connection {} -> {} while loading '{}': {}", out, in, flow.title(), v);
            }
        }
        log.info("Loaded {} nodes into flow '{}'", created.size(), flow.title());
        return remap;
    }

    private void syncInputs(AbstractNode node, List<FlowDefinition.PortDef> defs) {
        if (defs == null)
            return;
        for (int i = 0; i < defs.size(); i++) {
            FlowDefinition.PortDef pd = defs.get(i);
            if (i < node.inputs().size()) {
                NodeInput in = node.inputs().get(i);
                if (pd.getLabel() != null)
                    in.rename(pd.getLabel());
                if (pd.getDefaultValue() != null)
                    in.setDefaultValue(pd.getDefaultValue());
            } else {
                node.createInput(config(pd));
            }
        }
        while (node.inputs().size() > defs.size())
            node.deleteInput(node.inputs().size() - 1);
    }

    private void syncOutputs(AbstractNode node, List<FlowDefinition.PortDef> defs) {
        if (defs == null)
            return;
        for (int i = 0; i < defs.size(); i++) {
            FlowDefinition.PortDef pd = defs.get(i);
            if (i < node.outputs().size()) {
                if (pd.getLabel() != null)
                    node.outputs().get(i).rename(pd.getLabel());
            } else {
                node.createOutput(config(pd));
            }
        }
        while (node.outputs().size() > defs.size())
            node.deleteOutput(node.outputs().size() - 1);
    }

    private PortConfig config(FlowDefinition.PortDef pd) {
        PortKind kind = "exec".equalsIgnoreCase(pd.getKind()) ? PortKind.EXEC : PortKind.DATA;
        return new PortConfig(pd.getLabel(), kind, types.resolve(pd.getDataType()), pd.getDefaultValue());
    }

    private static void requireSize(Node node, String what, int actual, List<FlowDefinition.PortDef> defs) {
        if (defs != null && defs.size() != actual)
            throw new IllegalArgumentException("Node '" + node.title() + "' has " + actual + " " + what
                    + " but the definition lists " + defs.size());
    }

    private static Node nodeAt(List<Node> nodes, int index) {
        if (index < 0 || index >= nodes.size())
            throw new IllegalArgumentException("Connection refers to node index " + index + " of " + nodes.size());
        return nodes.get(index);
    }

    private static <P extends NodePort> P portAt(List<P> ports, int index, Node node) {
        if (index < 0 || index >= ports.size())
            throw new IllegalArgumentException("Connection refers to port " + index + " of '" + node.title()
                    + "' which has " + ports.size());
        return ports.get(index);
    }
}

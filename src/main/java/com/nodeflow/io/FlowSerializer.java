package com.nodeflow.io;

import com.nodeflow.api.*;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.TypeRegistry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Converts flows to {@link FlowDefinition}s and definitions to and from JSON.
 *
 * Only structure and configuration are exported: node order, ports, properties
 * and connections. Output values and executor state are not.
 */
public final class FlowSerializer {
    private final ObjectMapper mapper;

    public FlowSerializer() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public FlowSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public FlowDefinition export(Flow flow) {
        FlowDefinition def = new FlowDefinition();
        def.setTitle(flow.title());
        def.setAlgorithmMode(flow.algorithmMode().label());

        List<FlowDefinition.NodeDef> nodes = new ArrayList<>();
        for (Node n : flow.nodes()) {
            FlowDefinition.NodeDef nd = new FlowDefinition.NodeDef();
            nd.setId(n.id());
            nd.setIdentifier(n.identifier());
            nd.setTitle(n.title());
            if (!n.properties().isEmpty())
                nd.setProperties(new LinkedHashMap<>(n.properties()));
            for (NodeInput in : n.inputs())
                nd.getInputs().add(port(in, in.defaultValue()));
            for (NodeOutput out : n.outputs())
                nd.getOutputs().add(port(out, null));
            nodes.add(nd);
        }
        def.setNodes(nodes);

        List<FlowDefinition.ConnectionDef> connections = new ArrayList<>();
        for (ConnectionInfo c : flow.connectionInfos()) {
            connections.add(new FlowDefinition.ConnectionDef(c.sourceNode(), c.sourcePort(), c.targetNode(),
                    c.targetPort()));
        }
        def.setConnections(connections);
        return def;
    }

    private static FlowDefinition.PortDef port(NodePort p, Object defaultValue) {
        FlowDefinition.PortDef pd = new FlowDefinition.PortDef();
        pd.setKind(p.kind().name().toLowerCase());
        pd.setLabel(p.label());
        pd.setDataType(TypeRegistry.nameOf(p.allowedData()));
        pd.setDefaultValue(defaultValue);
        return pd;
    }

    public String toJson(Flow flow) {
        return toJson(export(flow));
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid definition
     */
    public FlowDefinition parse(String json) {
        try {
            return mapper.readValue(json, FlowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid flow definition: " + e.getOriginalMessage(), e);
        }
    }

    public FlowDefinition read(Path path) throws IOException {
        return mapper.readValue(Files.readString(path), FlowDefinition.class);
    }

    public void write(Flow flow, Path path) throws IOException {
        Files.writeString(path, toJson(flow));
    }
}

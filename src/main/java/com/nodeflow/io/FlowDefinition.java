package com.nodeflow.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a flow's structure.
 *
 * Nodes are listed in flow order; connections refer to nodes by their index in
 * {@link #nodes} and to ports by their index on the node.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FlowDefinition {
    private String title;
    private String algorithmMode;
    private List<NodeDef> nodes = new ArrayList<>();
    private List<ConnectionDef> connections = new ArrayList<>();

    /** A node: identity at export time, type identifier, configuration and ports. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private long id;
        private String identifier, title;
        private Map<String, Object> properties;
        private List<PortDef> inputs = new ArrayList<>();
        private List<PortDef> outputs = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class PortDef {
        private String kind, label, dataType;
        private Object defaultValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionDef {
        private int parentNodeIndex, outputPortIndex, connectedNodeIndex, connectedInputPortIndex;

        public ConnectionDef() {
        }

        public ConnectionDef(int parentNodeIndex, int outputPortIndex, int connectedNodeIndex,
                int connectedInputPortIndex) {
            this.parentNodeIndex = parentNodeIndex;
            this.outputPortIndex = outputPortIndex;
            this.connectedNodeIndex = connectedNodeIndex;
            this.connectedInputPortIndex = connectedInputPortIndex;
        }
    }
}

package com.nodeflow.engine;

import com.nodeflow.api.*;
import com.nodeflow.node.NodeFactory;
import com.nodeflow.util.CompositeFlowListener;
import com.nodeflow.util.Event;
import com.nodeflow.util.IdCounter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A directed graph of nodes whose output ports connect to input ports.
 *
 * The flow owns the topology and the active executor; nodes own their ports.
 *
 * Structure:
 * - {@code graphAdj}: every output port of a placed node to its connected
 * inputs, in connection order.
 * - {@code graphAdjRev}: every input port of a placed node to its connected
 * output, or null.
 * - {@code nodeSuccessors}: every placed node to the owners of the inputs its
 * outputs feed, one entry per connection (a multiset).
 *
 * An input holds at most one connection. Connection requests are validated
 * and answered with a {@link ConnValidType}; invalid requests are rejected
 * without throwing and without side effects.
 *
 * Topology Lock:
 * While a traversal runs (an optimized execution or a player pass) the
 * topology is locked and every structural mutation throws
 * {@link IllegalStateException}. Mutations between executions are always
 * allowed.
 *
 * Threading:
 * A flow is not thread-safe. It is built and mutated by one thread; a player
 * drives it from its own loop thread while playing.
 */
public class Flow {
    private static final Logger log = LogManager.getLogger(Flow.class);

    public final Event<Node> nodeCreated = new Event<>();
    public final Event<Node> nodeAdded = new Event<>();
    public final Event<Node> nodeRemoved = new Event<>();
    public final Event<Connection> connectionAdded = new Event<>();
    public final Event<Connection> connectionRemoved = new Event<>();
    /** Emitted with the verdict of every connection validity check. */
    public final Event<ConnValidType> connectionRequestValid = new Event<>();
    public final Event<FlowAlg> algorithmModeChanged = new Event<>();

    private final String title;
    private final IdCounter ids;
    private final TypeChecker types;
    private final CompositeFlowListener listener = new CompositeFlowListener();
    private final AtomicInteger traversals = new AtomicInteger();

    private final List<Node> nodes = new ArrayList<>();
    private final Map<Node, List<Node>> nodeSuccessors = new HashMap<>();
    private final Map<NodeOutput, List<NodeInput>> graphAdj = new HashMap<>();
    private final Map<NodeInput, NodeOutput> graphAdjRev = new HashMap<>();

    private FlowExecutor executor;

    public Flow(String title) {
        this(title, new IdCounter(), new TypeRegistry());
    }

    public Flow(String title, IdCounter ids, TypeChecker types) {
        this.title = Objects.requireNonNull(title, "title");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.types = Objects.requireNonNull(types, "types");
        this.executor = createExecutor(FlowAlg.DATA);
    }

    public String title() {
        return title;
    }

    public IdCounter ids() {
        return ids;
    }

    public TypeChecker types() {
        return types;
    }

    /** Listener fan-out for execution callbacks. Always present. */
    public CompositeFlowListener listener() {
        return listener;
    }

    public void addListener(FlowListener l) {
        listener.add(l);
    }

    public boolean removeListener(FlowListener l) {
        return listener.remove(l);
    }

    // -------------------------------------------------------------------------
    // Executor
    // -------------------------------------------------------------------------

    public FlowExecutor executor() {
        return executor;
    }

    public FlowAlg algorithmMode() {
        return executor.algorithm();
    }

    /**
     * Creates a fresh executor for the mode and installs it.
     *
     * @return false if the flow already runs in this mode
     */
    public boolean setAlgorithmMode(FlowAlg mode) {
        if (mode == executor.algorithm())
            return false;
        setExecutor(createExecutor(mode));
        return true;
    }

    /** @see FlowAlg#fromString(String) */
    public boolean setAlgorithmMode(String mode) {
        return setAlgorithmMode(FlowAlg.fromString(mode));
    }

    /**
     * Installs an executor created for this flow. Used by players to swap in a
     * manual executor while playing.
     */
    public void setExecutor(FlowExecutor next) {
        if (next.flow() != this)
            throw new IllegalArgumentException("Executor " + next + " belongs to another flow");
        if (executor.isExecuting())
            throw new IllegalStateException("Cannot replace the executor of flow '" + title + "' while it executes");
        FlowAlg prev = executor.algorithm();
        executor = next;
        log.debug("Flow '{}' now runs {}", title, next);
        if (prev != next.algorithm())
            algorithmModeChanged.emit(next.algorithm());
    }

    public FlowExecutor createExecutor(FlowAlg mode) {
        return switch (mode) {
            case MANUAL -> new ManualFlow(this);
            case DATA -> new DataFlowNaive(this);
            case DATA_OPT -> new DataFlowOptimized(this);
            case EXEC -> new ExecFlowNaive(this);
        };
    }

    // -------------------------------------------------------------------------
    // Nodes
    // -------------------------------------------------------------------------

    /** Creates a node with the factory and places it. */
    public <N extends Node> N createNode(NodeFactory<N> factory) {
        N node = factory.create(this);
        nodeCreated.emit(node);
        addNode(node);
        return node;
    }

    /**
     * Places a node. Also used to re-add a previously removed node.
     *
     * @throws IllegalArgumentException if the node is already placed
     */
    public void addNode(Node node) {
        requireUnlocked();
        if (isPlaced(node))
            throw new IllegalArgumentException("Node '" + node.title() + "' is already placed in flow '" + title + "'");
        nodes.add(node);
        nodeSuccessors.put(node, new ArrayList<>());
        for (NodeOutput out : node.outputs())
            graphAdj.put(out, new ArrayList<>());
        for (NodeInput in : node.inputs())
            graphAdjRev.put(in, null);
        node.placeEvent();
        flowChanged();
        nodeAdded.emit(node);
    }

    /**
     * Removes a node after disconnecting all its ports. The node object is not
     * destroyed and may be re-added.
     *
     * @return the removed connections, in removal order, so callers can restore them
     */
    public List<Connection> removeNode(Node node) {
        requireUnlocked();
        requirePlaced(node);
        List<Connection> broken = new ArrayList<>();
        for (NodeInput in : node.inputs()) {
            NodeOutput src = graphAdjRev.get(in);
            if (src != null)
                broken.add(removeConnection(src, in, true));
        }
        for (NodeOutput out : node.outputs()) {
            for (NodeInput in : List.copyOf(graphAdj.get(out)))
                broken.add(removeConnection(out, in, false));
        }
        node.removeEvent();
        nodes.remove(node);
        nodeSuccessors.remove(node);
        for (NodeOutput out : node.outputs())
            graphAdj.remove(out);
        for (NodeInput in : node.inputs())
            graphAdjRev.remove(in);
        flowChanged();
        nodeRemoved.emit(node);
        return broken;
    }

    public boolean isPlaced(Node node) {
        return nodeSuccessors.containsKey(node);
    }

    /** Placed nodes in insertion order. */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public int indexOf(Node node) {
        return nodes.indexOf(node);
    }

    /** Owners of the inputs fed by the node, one entry per connection. */
    public List<Node> successors(Node node) {
        List<Node> s = nodeSuccessors.get(node);
        return s == null ? List.of() : Collections.unmodifiableList(s);
    }

    /** Distinct owners of the outputs feeding the node, in input order. */
    public List<Node> predecessors(Node node) {
        Set<Node> preds = new LinkedHashSet<>();
        for (NodeInput in : node.inputs()) {
            NodeOutput src = graphAdjRev.get(in);
            if (src != null)
                preds.add(src.node());
        }
        return new ArrayList<>(preds);
    }

    // -------------------------------------------------------------------------
    // Ports
    // -------------------------------------------------------------------------

    /** Registers a port a placed node created at runtime. */
    public void portAdded(NodePort port) {
        if (!isPlaced(port.node()))
            return;
        requireUnlocked();
        if (port instanceof NodeOutput out)
            graphAdj.put(out, new ArrayList<>());
        else
            graphAdjRev.put((NodeInput) port, null);
        flowChanged();
    }

    /**
     * Disconnects a port of a placed node before the node deletes it.
     *
     * @return the removed connections
     */
    public List<Connection> disconnectPort(NodePort port) {
        if (!isPlaced(port.node()))
            return List.of();
        requireUnlocked();
        List<Connection> broken = new ArrayList<>();
        if (port instanceof NodeOutput out) {
            for (NodeInput in : List.copyOf(graphAdj.get(out)))
                broken.add(removeConnection(out, in, false));
        } else {
            NodeInput in = (NodeInput) port;
            NodeOutput src = graphAdjRev.get(in);
            if (src != null)
                broken.add(removeConnection(src, in, true));
        }
        return broken;
    }

    /** Forgets a port its node deleted. */
    public void portRemoved(NodePort port) {
        if (!isPlaced(port.node()))
            return;
        requireUnlocked();
        if (port instanceof NodeOutput out)
            graphAdj.remove(out);
        else
            graphAdjRev.remove((NodeInput) port);
        flowChanged();
    }

    // -------------------------------------------------------------------------
    // Connections
    // -------------------------------------------------------------------------

    /**
     * Checks whether a connection between the two ports would be valid,
     * ignoring the current connections.
     *
     * Checks, in order: same node, same direction, direction mismatch, port
     * kind, and for data ports the declared types.
     *
     * @throws IllegalArgumentException if a port does not belong to this flow
     */
    public ConnValidType checkConnectionValidity(NodePort out, NodePort in) {
        ConnValidType v = validate(out, in);
        connectionRequestValid.emit(v);
        return v;
    }

    /** Like {@link #checkConnectionValidity} but also rejects existing or blocked connections. */
    public ConnValidType canPortsConnect(NodePort out, NodePort in) {
        ConnValidType v = validate(out, in);
        if (v == ConnValidType.VALID) {
            if (graphAdj.get(out).contains(in))
                v = ConnValidType.ALREADY_CONNECTED;
            else if (graphAdjRev.get(in) != null)
                v = ConnValidType.INPUT_TAKEN;
        }
        connectionRequestValid.emit(v);
        return v;
    }

    /** Checks whether the two ports could be disconnected. */
    public ConnValidType canPortsDisconnect(NodePort out, NodePort in) {
        ConnValidType v = validate(out, in);
        if (v == ConnValidType.VALID && !graphAdj.get(out).contains(in))
            v = ConnValidType.ALREADY_DISCONNECTED;
        connectionRequestValid.emit(v);
        return v;
    }

    public ConnValidType connectPorts(NodePort out, NodePort in) {
        return connectPorts(out, in, false);
    }

    /**
     * Connects an output to an input if the request is valid.
     *
     * @param silent if true the executor does not react to the new connection
     * @return {@link ConnValidType#VALID} if the connection was created,
     *         otherwise the reason it was not
     */
    public ConnValidType connectPorts(NodePort out, NodePort in, boolean silent) {
        requireUnlocked();
        ConnValidType v = canPortsConnect(out, in);
        if (v != ConnValidType.VALID) {
            log.debug("Rejected connection {} -> {}: {}", out, in, v);
            return v;
        }
        NodeOutput o = (NodeOutput) out;
        NodeInput i = (NodeInput) in;
        graphAdj.get(o).add(i);
        graphAdjRev.put(i, o);
        nodeSuccessors.get(o.node()).add(i.node());
        flowChanged();
        Connection c = new Connection(o, i);
        executor.connAdded(c, silent);
        connectionAdded.emit(c);
        return ConnValidType.VALID;
    }

    /** Connects output {@code outIndex} of one node to input {@code inIndex} of another. */
    public ConnValidType connectNodes(Node from, int outIndex, Node to, int inIndex) {
        return connectPorts(from.outputs().get(outIndex), to.inputs().get(inIndex));
    }

    public ConnValidType disconnectPorts(NodePort out, NodePort in) {
        return disconnectPorts(out, in, false);
    }

    /**
     * Removes the connection between the two ports if it exists.
     *
     * @return {@link ConnValidType#VALID} if a connection was removed
     */
    public ConnValidType disconnectPorts(NodePort out, NodePort in, boolean silent) {
        requireUnlocked();
        ConnValidType v = canPortsDisconnect(out, in);
        if (v != ConnValidType.VALID)
            return v;
        removeConnection((NodeOutput) out, (NodeInput) in, silent);
        return ConnValidType.VALID;
    }

    public ConnValidType disconnectNodes(Node from, int outIndex, Node to, int inIndex) {
        return disconnectPorts(from.outputs().get(outIndex), to.inputs().get(inIndex));
    }

    private Connection removeConnection(NodeOutput out, NodeInput in, boolean silent) {
        graphAdj.get(out).remove(in);
        graphAdjRev.put(in, null);
        nodeSuccessors.get(out.node()).remove(in.node());
        flowChanged();
        Connection c = new Connection(out, in);
        executor.connRemoved(c, silent);
        connectionRemoved.emit(c);
        return c;
    }

    private ConnValidType validate(NodePort out, NodePort in) {
        requireOwned(out);
        requireOwned(in);
        if (out.node() == in.node())
            return ConnValidType.SAME_NODE;
        if (out.direction() == in.direction())
            return ConnValidType.SAME_IO;
        if (out.direction() != PortDirection.OUTPUT)
            return ConnValidType.IO_MISMATCH;
        if (out.kind() != in.kind())
            return ConnValidType.DIFF_ALG_TYPE;
        if (out.isData() && !types.canConnect(out.allowedData(), in.allowedData()))
            return ConnValidType.DATA_MISMATCH;
        return ConnValidType.VALID;
    }

    /** Inputs connected to the output, in connection order. */
    public List<NodeInput> connectedInputs(NodeOutput out) {
        List<NodeInput> l = graphAdj.get(out);
        return l == null ? List.of() : Collections.unmodifiableList(l);
    }

    /** The output connected to the input, or null. */
    public NodeOutput connectedOutput(NodeInput in) {
        return graphAdjRev.get(in);
    }

    public boolean isConnected(NodePort port) {
        if (port instanceof NodeOutput out) {
            List<NodeInput> l = graphAdj.get(out);
            return l != null && !l.isEmpty();
        }
        return graphAdjRev.get(port) != null;
    }

    /** All connections, ordered by source node, source port and connection order. */
    public List<Connection> connections() {
        List<Connection> result = new ArrayList<>();
        for (Node n : nodes) {
            for (NodeOutput out : n.outputs()) {
                for (NodeInput in : graphAdj.get(out))
                    result.add(new Connection(out, in));
            }
        }
        return result;
    }

    /** All connections as index tuples over the current node order. */
    public List<ConnectionInfo> connectionInfos() {
        List<ConnectionInfo> result = new ArrayList<>();
        for (Connection c : connections()) {
            result.add(new ConnectionInfo(nodes.indexOf(c.out().node()), c.out().index(),
                    nodes.indexOf(c.in().node()), c.in().index()));
        }
        return result;
    }

    // -------------------------------------------------------------------------
    // Topology lock
    // -------------------------------------------------------------------------

    public void beginTraversal() {
        traversals.incrementAndGet();
    }

    public void endTraversal() {
        if (traversals.decrementAndGet() < 0) {
            traversals.set(0);
            throw new IllegalStateException("Unbalanced endTraversal on flow '" + title + "'");
        }
    }

    public boolean isTraversing() {
        return traversals.get() > 0;
    }

    private void requireUnlocked() {
        if (traversals.get() > 0)
            throw new IllegalStateException("Topology of flow '" + title + "' is locked during an execution");
    }

    private void requirePlaced(Node node) {
        if (!isPlaced(node))
            throw new IllegalArgumentException("Node '" + node.title() + "' is not placed in flow '" + title + "'");
    }

    private void requireOwned(NodePort port) {
        if (!isPlaced(port.node()) || port.index() < 0)
            throw new IllegalArgumentException("Port " + port + " does not belong to flow '" + title + "'");
    }

    private void flowChanged() {
        executor.flowChanged();
    }

    /** Removes every node and drops all subscribers and listeners. */
    public void destroy() {
        for (Node n : new ArrayList<>(nodes))
            removeNode(n);
        for (Event<?> e : List.of(nodeCreated, nodeAdded, nodeRemoved, connectionAdded, connectionRemoved,
                connectionRequestValid, algorithmModeChanged))
            e.clear();
        log.info("Flow '{}' destroyed", title);
    }

    @Override
    public String toString() {
        return "Flow[" + title + ", " + nodes.size() + " nodes, " + executor.algorithm() + "]";
    }
}

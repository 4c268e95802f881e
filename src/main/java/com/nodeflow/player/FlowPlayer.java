package com.nodeflow.player;

import com.nodeflow.api.Node;
import com.nodeflow.api.NodeInput;
import com.nodeflow.api.NodePort;
import com.nodeflow.engine.ExecutionCycleException;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.FlowExecutor;
import com.nodeflow.engine.ManualFlow;
import com.nodeflow.util.ErrorRateLimiter;

import lombok.extern.log4j.Log4j2;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Default player.
 *
 * Play:
 * 1. Collects the active nodes (nodes with a connected port, and frame-driven
 * nodes), the roots among them (no connected input) and the frame nodes.
 * 2. Installs a {@link ManualFlow} on the flow, remembering the previous
 * executor, and calls {@code init()} on every active node.
 * 3. Runs one pass from the roots.
 * 4. If there are frame nodes, ticks: every frame calls
 * {@code frameUpdateEvent()} on the unfinished frame nodes, runs a pass from
 * those that produced output, then sleeps out the rest of the frame. The loop
 * ends on {@link #stop()} or when every frame node is finished.
 *
 * Pass:
 * Nodes run in breadth-first topological order, each at most once and only
 * after all its in-pass predecessors. Roots run with trigger -1; every other
 * node runs if one of its inputs saw fresh data, with the lowest such input as
 * trigger. The flow's topology is locked during a pass.
 *
 * On stop the previous executor is restored; the graph time is kept until the
 * next play.
 */
@Log4j2
public class FlowPlayer extends GraphPlayer {
    public static final int DEFAULT_FRAMES = 30;

    private final ErrorRateLimiter errorLog = new ErrorRateLimiter(log, 1000);

    private final List<Node> nodes = new ArrayList<>();
    private final List<Node> roots = new ArrayList<>();
    private final List<Node> frameNodes = new ArrayList<>();

    private volatile boolean stopFlag;
    private ManualFlow manual;
    private FlowExecutor saved;

    public FlowPlayer() {
        this(DEFAULT_FRAMES);
    }

    public FlowPlayer(int frames) {
        super(frames);
    }

    public FlowPlayer(Flow flow, int frames) {
        super(frames);
        setFlow(flow);
    }

    @Override
    protected synchronized GraphActionResponse begin() {
        Flow f = flow();
        if (f == null)
            return GraphActionResponse.NO_GRAPH;
        if (state() != GraphState.STOPPED)
            return GraphActionResponse.NOT_ALLOWED;

        stopFlag = false;
        graphTime.reset();
        gatherNodes(f);
        manual = new ManualFlow(f);
        saved = f.executor();
        f.setExecutor(manual);
        log.info("Playing flow '{}': {} active nodes, {} roots, {} frame nodes at {} fps", f.title(), nodes.size(),
                roots.size(), frameNodes.size(), graphTime.frames());
        transition(GraphState.PLAYING);
        return GraphActionResponse.SUCCESS;
    }

    @Override
    protected void run() {
        Flow f = flow();
        try {
            for (Node n : nodes)
                hook(n, Node::init, "init");
            pass(roots, true);
            if (frameNodes.isEmpty())
                return;

            List<Node> produced = new ArrayList<>();
            while (!stopFlag) {
                if (state() == GraphState.PAUSED) {
                    sleepNanos(graphTime.frameDurationNanos());
                    continue;
                }

                graphTime.nextFrame();
                long start = System.nanoTime();

                produced.clear();
                for (Node n : frameNodes) {
                    if (n.isFinished())
                        continue;
                    hook(n, Node::frameUpdateEvent, "frameUpdateEvent");
                    if (manual.hasUpdatedOutputs(n))
                        produced.add(n);
                }
                pass(produced, false);

                long wait = graphTime.frameDurationNanos() - (System.nanoTime() - start);
                if (wait > 0)
                    sleepNanos(wait);
                graphTime.setDeltaTime((System.nanoTime() - start) / 1e9);

                if (allFinished())
                    break;
            }
        } catch (RuntimeException e) {
            log.error("Player of flow '{}' failed", f.title(), e);
            throw e;
        } finally {
            onStop();
        }
    }

    @Override
    protected void halt() {
        onStop();
    }

    @Override
    public synchronized GraphActionResponse pause() {
        if (flow() == null)
            return GraphActionResponse.NO_GRAPH;
        if (state() != GraphState.PLAYING || frameNodes.isEmpty())
            return GraphActionResponse.NOT_ALLOWED;
        for (Node n : nodes)
            hook(n, Node::pause, "pause");
        transition(GraphState.PAUSED);
        return GraphActionResponse.SUCCESS;
    }

    @Override
    public synchronized GraphActionResponse resume() {
        if (flow() == null)
            return GraphActionResponse.NO_GRAPH;
        if (state() != GraphState.PAUSED)
            return GraphActionResponse.NOT_ALLOWED;
        transition(GraphState.PLAYING);
        return GraphActionResponse.SUCCESS;
    }

    @Override
    public synchronized GraphActionResponse stop() {
        if (flow() == null)
            return GraphActionResponse.NO_GRAPH;
        if (state() == GraphState.STOPPED)
            return GraphActionResponse.NOT_ALLOWED;
        stopFlag = true;
        return GraphActionResponse.SUCCESS;
    }

    /** Nodes collected on the last play. */
    public synchronized List<Node> activeNodes() {
        return List.copyOf(nodes);
    }

    public synchronized List<Node> rootNodes() {
        return List.copyOf(roots);
    }

    public synchronized List<Node> frameNodes() {
        return List.copyOf(frameNodes);
    }

    private synchronized void onStop() {
        if (state() == GraphState.STOPPED)
            return;
        Flow f = flow();
        for (Node n : nodes)
            hook(n, Node::stop, "stop");
        if (f.executor() == manual)
            f.setExecutor(saved);
        saved.flowChanged();
        saved = null;
        manual = null;
        log.info("Stopped flow '{}' after {} frames", f.title(), graphTime.frameCount());
        transition(GraphState.STOPPED);
    }

    private void gatherNodes(Flow f) {
        nodes.clear();
        roots.clear();
        frameNodes.clear();
        for (Node n : f.nodes()) {
            boolean anyInput = anyConnected(f, n.inputs());
            boolean anyOutput = anyConnected(f, n.outputs());
            if (!anyInput && !anyOutput && !n.isFrameDriven())
                continue;
            nodes.add(n);
            if (!anyInput)
                roots.add(n);
            if (n.isFrameDriven())
                frameNodes.add(n);
        }
    }

    private static boolean anyConnected(Flow f, List<? extends NodePort> ports) {
        for (NodePort p : ports) {
            if (f.isConnected(p))
                return true;
        }
        return false;
    }

    private boolean allFinished() {
        for (Node n : frameNodes) {
            if (!n.isFinished())
                return false;
        }
        return true;
    }

    /**
     * Runs the starts and everything reachable from them in topological order.
     *
     * @param invokeStarts whether the start nodes themselves are updated
     */
    private void pass(List<Node> starts, boolean invokeStarts) {
        ManualFlow m = manual;
        if (starts.isEmpty()) {
            m.clearUpdates();
            return;
        }
        Flow f = flow();
        if (f.executor() != m)
            throw new IllegalStateException("Executor of flow '" + f.title() + "' was replaced while playing");

        List<Node> order = order(f, starts);
        Set<Node> startSet = new HashSet<>(starts);
        f.beginTraversal();
        try {
            m.execute(() -> {
                for (Node n : order) {
                    if (startSet.contains(n)) {
                        if (invokeStarts)
                            m.updateNode(n, -1);
                        continue;
                    }
                    int trigger = freshInput(m, n);
                    if (trigger >= 0)
                        m.updateNode(n, trigger);
                }
            });
        } finally {
            f.endTraversal();
            m.clearUpdates();
        }
    }

    /** Breadth-first topological order of the subgraph reachable from the starts. */
    private static List<Node> order(Flow f, List<Node> starts) {
        Set<Node> startSet = new HashSet<>(starts);
        Map<Node, List<Node>> succ = new HashMap<>();
        Map<Node, Integer> waiting = new HashMap<>();
        Set<Node> scope = new LinkedHashSet<>(starts);
        ArrayDeque<Node> queue = new ArrayDeque<>(starts);
        while (!queue.isEmpty()) {
            Node n = queue.poll();
            List<Node> distinct = new ArrayList<>(new LinkedHashSet<>(f.successors(n)));
            succ.put(n, distinct);
            for (Node s : distinct) {
                if (!startSet.contains(s))
                    waiting.merge(s, 1, Integer::sum);
                if (scope.add(s))
                    queue.add(s);
            }
        }

        List<Node> order = new ArrayList<>(scope.size());
        queue.addAll(starts);
        while (!queue.isEmpty()) {
            Node n = queue.poll();
            order.add(n);
            for (Node s : succ.get(n)) {
                if (!startSet.contains(s) && waiting.merge(s, -1, Integer::sum) == 0)
                    queue.add(s);
            }
        }
        if (order.size() != scope.size())
            throw new ExecutionCycleException("Cycle among the active nodes of flow '" + f.title() + "'");
        return order;
    }

    private static int freshInput(ManualFlow m, Node n) {
        List<NodeInput> ins = n.inputs();
        for (int i = 0; i < ins.size(); i++) {
            if (m.shouldInputUpdate(ins.get(i)))
                return i;
        }
        return -1;
    }

    private void hook(Node n, Consumer<Node> hook, String name) {
        try {
            hook.accept(n);
        } catch (Exception e) {
            errorLog.log("Node '" + n.title() + "' failed in " + name, e);
            FlowExecutor ex = flow().executor();
            flow().listener().onNodeError(ex.executionCount(), n, -1, e);
        }
    }

    private void sleepNanos(long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopFlag = true;
        }
    }
}

package com.nodeflow.engine;

import com.nodeflow.api.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Push-based data flow that updates every affected node at most once.
 *
 * Algorithm:
 *
 * 1. Plan: starting from the trigger node, collect the reachable subgraph and,
 * for every reachable node, its wait count: the number of distinct reachable
 * predecessors. The plan is cached per trigger node and dropped on any
 * structural change. Planning is linear in the size of the subgraph and fails
 * fast with {@link ExecutionCycleException} if the subgraph contains a cycle.
 *
 * 2. Mark: setting an output inside the execution only stores the value and
 * marks the output dirty.
 *
 * 3. Release: when a node is finished, each of its dirty outputs activates its
 * connections once, which marks the target inputs fresh, and every distinct
 * successor's wait count drops by one.
 *
 * 4. Run: a node whose wait count reaches zero runs exactly once, triggered by
 * its lowest fresh input. A node without fresh inputs is skipped but still
 * releases its successors, as is a node whose callback threw.
 *
 * The topology of the flow is locked while an execution runs. Updates requested
 * from inside a callback run immediately and do not start a new plan.
 */
public class DataFlowOptimized extends DataFlowNaive {
    private static final Logger log = LogManager.getLogger(DataFlowOptimized.class);

    static final class Plan {
        final Node root;
        final Set<Node> reachable;
        final Map<Node, Integer> waitCounts;
        final Map<Node, List<Node>> successors;

        Plan(Node root, Set<Node> reachable, Map<Node, Integer> waitCounts, Map<Node, List<Node>> successors) {
            this.root = root;
            this.reachable = reachable;
            this.waitCounts = waitCounts;
            this.successors = successors;
        }
    }

    private final Map<Node, Plan> plans = new HashMap<>();

    // State of the running execution, null/empty in between.
    private Plan current;
    private final Map<Node, Integer> waiting = new HashMap<>();
    private final Map<Node, Integer> fresh = new HashMap<>();
    private final Set<NodeOutput> dirty = new HashSet<>();
    private final Set<Node> finished = new HashSet<>();
    private final ArrayDeque<Node> ready = new ArrayDeque<>();

    public DataFlowOptimized(Flow flow) {
        super(flow);
    }

    @Override
    public FlowAlg algorithm() {
        return FlowAlg.DATA_OPT;
    }

    @Override
    public void updateNode(Node node, int input) {
        if (current != null) {
            super.updateNode(node, input);
            return;
        }
        run(node, () -> invoke(node, input));
    }

    @Override
    public void setOutput(Node node, int index, Object value) {
        NodeOutput out = storeOutput(node, index, value);
        mark(node, out);
    }

    @Override
    public void execOutput(Node node, int index) {
        NodeOutput out = execPort(node, index);
        mark(node, out);
    }

    private void mark(Node node, NodeOutput out) {
        if (current == null) {
            run(node, () -> dirty.add(out));
            return;
        }
        if (current.reachable.contains(node) && !finished.contains(node))
            dirty.add(out);
        else
            log.debug("Output {} set outside the running plan of '{}', not propagated", out, current.root.title());
    }

    @Override
    public void connAdded(Connection connection, boolean silent) {
        try {
            super.connAdded(connection, silent);
        } catch (ExecutionCycleException e) {
            log.warn("Connection {} closes a cycle, its target was not updated: {}", connection, e.getMessage());
        }
    }

    @Override
    public void connRemoved(Connection connection, boolean silent) {
        try {
            super.connRemoved(connection, silent);
        } catch (ExecutionCycleException e) {
            log.warn("Target of removed connection {} was not updated: {}", connection, e.getMessage());
        }
    }

    @Override
    public void flowChanged() {
        plans.clear();
    }

    /** Number of cached plans. */
    public int cachedPlans() {
        return plans.size();
    }

    private void run(Node root, Runnable start) {
        Plan plan = planFor(root);
        beginExecution();
        flow.beginTraversal();
        try {
            current = plan;
            waiting.putAll(plan.waitCounts);
            start.run();
            finish(root);
            while (!ready.isEmpty()) {
                Node n = ready.poll();
                Integer trigger = fresh.remove(n);
                if (trigger != null)
                    invoke(n, trigger);
                finish(n);
            }
        } finally {
            current = null;
            waiting.clear();
            fresh.clear();
            dirty.clear();
            finished.clear();
            ready.clear();
            flow.endTraversal();
            endExecution();
        }
    }

    private void finish(Node node) {
        finished.add(node);
        for (NodeOutput out : node.outputs()) {
            if (!dirty.remove(out))
                continue;
            for (NodeInput in : flow.connectedInputs(out)) {
                activate(new Connection(out, in));
                fresh.merge(in.node(), in.index(), Math::min);
            }
        }
        for (Node succ : current.successors.get(node)) {
            if (waiting.merge(succ, -1, Integer::sum) == 0)
                ready.add(succ);
        }
    }

    Plan planFor(Node root) {
        Plan plan = plans.get(root);
        if (plan == null) {
            plan = buildPlan(root);
            plans.put(root, plan);
        }
        return plan;
    }

    private Plan buildPlan(Node root) {
        Set<Node> reachable = new LinkedHashSet<>();
        Map<Node, List<Node>> successors = new HashMap<>();
        Map<Node, Integer> waitCounts = new HashMap<>();
        ArrayDeque<Node> queue = new ArrayDeque<>();

        reachable.add(root);
        queue.add(root);
        while (!queue.isEmpty()) {
            Node n = queue.poll();
            List<Node> distinct = new ArrayList<>(new LinkedHashSet<>(flow.successors(n)));
            successors.put(n, distinct);
            waitCounts.putIfAbsent(n, 0);
            for (Node s : distinct) {
                waitCounts.merge(s, 1, Integer::sum);
                if (reachable.add(s))
                    queue.add(s);
            }
        }

        // Kahn's algorithm over the reachable subgraph.
        if (waitCounts.get(root) != 0)
            throw cycle(root);
        Map<Node, Integer> remaining = new HashMap<>(waitCounts);
        queue.add(root);
        int visited = 0;
        while (!queue.isEmpty()) {
            Node n = queue.poll();
            visited++;
            for (Node s : successors.get(n)) {
                if (remaining.merge(s, -1, Integer::sum) == 0)
                    queue.add(s);
            }
        }
        if (visited != reachable.size())
            throw cycle(root);

        log.debug("Planned {} nodes from '{}'", reachable.size(), root.title());
        return new Plan(root, Collections.unmodifiableSet(reachable), waitCounts, successors);
    }

    private ExecutionCycleException cycle(Node root) {
        return new ExecutionCycleException("Cycle reachable from node '" + root.title() + "' in flow '"
                + flow.title() + "'");
    }
}

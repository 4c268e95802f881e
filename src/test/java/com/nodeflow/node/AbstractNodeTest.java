package com.nodeflow.node;

import com.nodeflow.api.NodeInput;
import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.TypeRegistry;
import com.nodeflow.node.NodeFixtures.ErrorCollector;
import com.nodeflow.node.NodeFixtures.Recorder;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class AbstractNodeTest {

    private Flow flow;

    @Before
    public void setUp() {
        flow = new Flow("nodes");
    }

    @Test
    public void testIdsAreUniqueAndAscending() {
        ValueNode a = flow.createNode(ValueNode::new);
        ValueNode b = flow.createNode(ValueNode::new);
        assertTrue(b.id() > a.id());
        assertEquals("ValueNode", a.identifier());
        assertEquals(-1, a.previousId());
    }

    @Test
    public void testCreateInputAtPosition() {
        Recorder rec = flow.createNode(f -> new Recorder(f, 2));
        NodeInput inserted = rec.createInput(PortConfig.data("first"), 0);

        assertEquals(3, rec.inputs().size());
        assertEquals(0, inserted.index());
        assertEquals("in0", rec.inputs().get(1).label());

        rec.renameInput(0, "renamed");
        assertEquals("renamed", inserted.label());
    }

    @Test
    public void testCreateInputWhileLockedLeavesNodeUnchanged() {
        Recorder rec = flow.createNode(f -> new Recorder(f, 1));
        flow.beginTraversal();
        try {
            assertThrows(IllegalStateException.class, () -> rec.createInput(PortConfig.data("late")));
        } finally {
            flow.endTraversal();
        }
        assertEquals(1, rec.inputs().size());
    }

    @Test
    public void testRuntimeOutputCanBeDeleted() {
        ValueNode v = flow.createNode(f -> new ValueNode(f, 1));
        ProbeNode p = flow.createNode(ProbeNode::new);
        v.createOutput(PortConfig.data("extra"));
        flow.connectNodes(v, 1, p, 0);

        v.deleteOutput(1);

        assertEquals(1, v.outputs().size());
        assertTrue(flow.connections().isEmpty());
    }

    @Test
    public void testBlockedUpdatesAreDropped() {
        Recorder rec = flow.createNode(f -> new Recorder(f, 1));
        rec.setBlockUpdates(true);
        rec.update();
        assertTrue(rec.isBlockingUpdates());
        assertTrue(rec.triggers.isEmpty());

        rec.setBlockUpdates(false);
        rec.update(0);
        assertEquals(List.of(0), rec.triggers);
    }

    @Test
    public void testTypedOutputRejectsWrongValues() {
        CounterFrameNode counter = flow.createNode(f -> new CounterFrameNode(f, 1));
        assertThrows(IllegalArgumentException.class, () -> counter.setOutput(0, "one"));
        counter.setOutput(0, null);
        counter.setOutput(0, 7);
        assertEquals(7, counter.outputs().get(0).value());
    }

    @Test
    public void testCannotSetExecOutputOrReadExecInput() {
        ActionNode action = flow.createNode(ActionNode::new);
        assertThrows(IllegalArgumentException.class, () -> action.setOutput(0, 1));
        assertThrows(IllegalArgumentException.class, () -> action.input(0));
    }

    @Test
    public void testNodeErrorsReachListeners() {
        ErrorCollector errors = new ErrorCollector();
        flow.addListener(errors);
        ValueNode v = flow.createNode(f -> new ValueNode(f, "x"));
        SumNode sum = flow.createNode(SumNode::new);
        flow.connectNodes(v, 0, sum, 0);
        errors.nodes.clear();

        v.update();

        assertEquals(List.of(sum), errors.nodes);
    }

    @Test
    public void testPropertiesFactories() {
        SumNode sum = SumNode.fromProperties(flow, Map.of(SumNode.OPERANDS, 4));
        assertEquals(4, sum.inputs().size());
        assertSame(TypeRegistry.DOUBLE, sum.outputs().get(0).allowedData());
        assertEquals(2, SumNode.fromProperties(flow, Map.of()).inputs().size());
        assertEquals("v", ValueNode.fromProperties(flow, Map.of(ValueNode.VALUE, "v")).value());
        assertEquals(5, CounterFrameNode.fromProperties(flow, Map.of(CounterFrameNode.FRAMES, 5)).frames());
        assertThrows(IllegalArgumentException.class, () -> new SumNode(flow, 0));
        assertThrows(IllegalArgumentException.class, () -> new CounterFrameNode(flow, 0));
        assertThrows(UnsupportedOperationException.class, () -> sum.properties().put("k", 1));
    }

    @Test
    public void testFrameNodeRestartsAfterInit() {
        CounterFrameNode counter = flow.createNode(f -> new CounterFrameNode(f, 2));
        counter.frameUpdateEvent();
        counter.frameUpdateEvent();
        assertTrue(counter.isFinished());

        counter.init();
        assertFalse(counter.isFinished());
        assertEquals(0, counter.count());
        assertTrue(counter.isFrameDriven());
    }
}

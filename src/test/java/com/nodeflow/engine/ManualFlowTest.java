package com.nodeflow.engine;

import com.nodeflow.api.FlowAlg;
import com.nodeflow.node.ProbeNode;
import com.nodeflow.node.SumNode;
import com.nodeflow.node.ValueNode;
import com.nodeflow.util.NodeProfileListener;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ManualFlowTest {

    private Flow flow;
    private ManualFlow manual;
    private ValueNode a;
    private ValueNode b;
    private SumNode sum;
    private ProbeNode probe;

    @Before
    public void setUp() {
        flow = new Flow("manual");
        flow.setAlgorithmMode(FlowAlg.MANUAL);
        manual = (ManualFlow) flow.executor();
        a = flow.createNode(f -> new ValueNode(f, 1));
        b = flow.createNode(f -> new ValueNode(f, 2));
        sum = flow.createNode(SumNode::new);
        probe = flow.createNode(ProbeNode::new);
        flow.connectNodes(a, 0, sum, 0);
        flow.connectNodes(b, 0, sum, 1);
        flow.connectNodes(sum, 0, probe, 0);
    }

    @Test
    public void testOutputsAreRecordedNotPropagated() {
        a.update();

        assertNull(sum.outputs().get(0).value());
        assertEquals(1, a.outputs().get(0).value());
        assertTrue(manual.hasUpdatedOutputs(a));
        assertFalse(manual.hasUpdatedOutputs(b));
        assertTrue(manual.shouldInputUpdate(sum.inputs().get(0)));
        assertFalse(manual.shouldInputUpdate(sum.inputs().get(1)));
        assertFalse(manual.shouldInputUpdate(probe.inputs().get(0)));
    }

    @Test
    public void testDriverRunsNodesItself() {
        a.update();
        b.update();
        sum.update(0);
        assertTrue(manual.isUpdated(sum.outputs().get(0)));
        assertEquals(0, probe.updates());

        manual.clearUpdates();
        assertFalse(manual.hasUpdatedOutputs(a));
        assertFalse(manual.shouldInputUpdate(sum.inputs().get(0)));
        assertEquals(3.0, sum.outputs().get(0).value());
    }

    @Test
    public void testUnconnectedInputIsNeverFresh() {
        ProbeNode lonely = flow.createNode(ProbeNode::new);
        a.update();
        assertFalse(manual.shouldInputUpdate(lonely.inputs().get(0)));
    }

    @Test
    public void testExecuteGroupsUpdatesIntoOneExecution() {
        NodeProfileListener profile = new NodeProfileListener();
        flow.addListener(profile);

        manual.execute(() -> {
            a.update();
            b.update();
            sum.update(0);
            assertTrue(manual.isExecuting());
        });

        assertEquals(1, profile.executions());
        assertEquals(1, profile.updates(sum));
        assertFalse(manual.isExecuting());
    }
}

package com.nodeflow;

import com.nodeflow.engine.Flow;
import com.nodeflow.node.CounterFrameNode;
import com.nodeflow.node.ProbeNode;
import com.nodeflow.node.ValueNode;
import com.nodeflow.player.GraphActionResponse;
import com.nodeflow.player.GraphState;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class FlowSessionTest {

    private FlowSession session;

    @Before
    public void setUp() {
        session = NodeFlow.session();
    }

    @After
    public void tearDown() {
        session.close();
    }

    @Test
    public void testCreateAndDeleteFlows() {
        List<String> created = new ArrayList<>();
        List<String> deleted = new ArrayList<>();
        session.flowCreated.subscribe(f -> created.add(f.title()));
        session.flowDeleted.subscribe(f -> deleted.add(f.title()));

        Flow main = session.createFlow("main");
        session.createFlow("side");
        assertThrows(IllegalArgumentException.class, () -> session.createFlow("main"));

        assertSame(main, session.flow("main"));
        assertNotNull(session.player("main"));
        assertEquals(List.of("main", "side"), session.flowTitles());

        assertTrue(session.deleteFlow("side"));
        assertFalse(session.deleteFlow("side"));
        assertEquals(List.of("main", "side"), created);
        assertEquals(List.of("side"), deleted);
        assertNull(session.player("side"));
    }

    @Test
    public void testFlowsShareIds() {
        Flow a = session.createFlow("a");
        Flow b = session.createFlow("b");
        ValueNode first = a.createNode(ValueNode::new);
        ValueNode second = b.createNode(ValueNode::new);
        assertEquals(first.id() + 1, second.id());
    }

    @Test
    public void testActionsOnUnknownFlow() {
        assertEquals(GraphActionResponse.NO_GRAPH, session.play("nope"));
        assertEquals(GraphActionResponse.NO_GRAPH, session.pause("nope"));
        assertEquals(GraphActionResponse.NO_GRAPH, session.resume("nope"));
        assertEquals(GraphActionResponse.NO_GRAPH, session.stop("nope"));
        assertNull(session.exportJson("nope"));
    }

    @Test
    public void testPlayRunsFlow() {
        Flow flow = session.createFlow("run");
        ValueNode v = flow.createNode(f -> new ValueNode(f, 3));
        ProbeNode p = flow.createNode(ProbeNode::new);
        flow.connectNodes(v, 0, p, 0);
        p.reset();

        assertEquals(GraphActionResponse.SUCCESS, session.play("run"));

        assertEquals(List.of(3), p.history());
    }

    @Test
    public void testDeleteStopsAsyncPlayer() {
        Flow flow = session.createFlow("ticking");
        flow.createNode(f -> new CounterFrameNode(f, 1_000_000));

        assertEquals(GraphActionResponse.SUCCESS, session.play("ticking", true));
        assertEquals(GraphState.PLAYING, session.player("ticking").state());
        assertEquals(GraphActionResponse.SUCCESS, session.pause("ticking"));
        assertEquals(GraphActionResponse.SUCCESS, session.resume("ticking"));

        assertTrue(session.deleteFlow("ticking"));
        assertTrue(flow.nodes().isEmpty());
    }

    @Test
    public void testImportPicksFreeTitle() {
        Flow flow = session.createFlow("copy me");
        ValueNode v = flow.createNode(f -> new ValueNode(f, "x"));
        ProbeNode p = flow.createNode(ProbeNode::new);
        flow.connectNodes(v, 0, p, 0);

        String json = session.exportJson("copy me");
        Flow first = session.importJson(json);
        Flow second = session.importFlow(session.exportFlow("copy me"));

        assertEquals("copy me (1)", first.title());
        assertEquals("copy me (2)", second.title());
        assertEquals(flow.connectionInfos(), second.connectionInfos());
        assertEquals(3, session.flows().size());
    }
}

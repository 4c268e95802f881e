package com.nodeflow.player;

import com.nodeflow.engine.Flow;
import com.nodeflow.node.ProbeNode;
import com.nodeflow.node.ValueNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.Assert.*;

public class GraphEventsTest {

    @Test
    public void testStateEventPrecedesGeneralEvent() {
        GraphEvents events = new GraphEvents();
        List<String> seen = new ArrayList<>();
        events.subscribe("play", e -> seen.add("play"));
        events.subscribe(GraphState.STOPPED, e -> seen.add("stopped"));
        events.subscribeStateChanged(e -> seen.add(e.getOldState() + ">" + e.getNewState()));

        events.emit(GraphState.STOPPED, GraphState.PLAYING);
        events.emit(GraphState.PLAYING, GraphState.STOPPED);

        assertEquals(List.of("play", "STOPPED>PLAYING", "stopped", "PLAYING>STOPPED"), seen);
    }

    @Test
    public void testUnsubscribeAndReset() {
        GraphEvents events = new GraphEvents();
        List<GraphStateEvent> seen = new ArrayList<>();
        Consumer<GraphStateEvent> cb = seen::add;
        events.subscribe("pause", cb);
        assertTrue(events.unsubscribe(GraphState.PAUSED, cb));
        events.subscribeStateChanged(cb);
        events.reset();

        events.emit(GraphState.PLAYING, GraphState.PAUSED);

        assertTrue(seen.isEmpty());
    }

    @Test
    public void testUnknownActionName() {
        GraphEvents events = new GraphEvents();
        assertThrows(IllegalArgumentException.class, () -> events.subscribe("rewind", e -> {
        }));
        assertEquals(GraphState.PAUSED, GraphEvents.stateOf("PAUSE"));
    }

    @Test
    public void testPlayerEmitsEveryTransition() {
        Flow flow = new Flow("events");
        ValueNode v = flow.createNode(f -> new ValueNode(f, 1));
        ProbeNode p = flow.createNode(ProbeNode::new);
        flow.connectNodes(v, 0, p, 0);
        FlowPlayer player = new FlowPlayer(flow, 60);
        List<GraphState> states = new ArrayList<>();
        player.events().subscribeStateChanged(e -> states.add(e.getNewState()));

        player.play();

        assertEquals(List.of(GraphState.PLAYING, GraphState.STOPPED), states);
    }
}

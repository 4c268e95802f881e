package com.nodeflow.player;

import com.nodeflow.engine.DataFlowNaive;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.ManualFlow;
import com.nodeflow.node.CounterFrameNode;
import com.nodeflow.node.NodeFixtures.ErrorCollector;
import com.nodeflow.node.NodeFixtures.Failing;
import com.nodeflow.node.NodeFixtures.Hooks;
import com.nodeflow.node.ProbeNode;
import com.nodeflow.node.SumNode;
import com.nodeflow.node.ValueNode;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.*;

public class FlowPlayerTest {

    private Flow flow;
    private FlowPlayer player;
    private ExecutorService pool;

    @Before
    public void setUp() {
        flow = new Flow("player");
        player = new FlowPlayer(flow, 200);
        pool = Executors.newSingleThreadExecutor();
    }

    @After
    public void tearDown() {
        if (player.state() != GraphState.STOPPED) {
            player.stop();
            player.awaitState(GraphState.STOPPED, 2_000);
        }
        pool.shutdownNow();
    }

    @Test
    public void testSinglePassWithoutFrameNodes() {
        ValueNode a = flow.createNode(f -> new ValueNode(f, 5));
        ValueNode b = flow.createNode(f -> new ValueNode(f, 7));
        SumNode sum = flow.createNode(SumNode::new);
        ProbeNode probe = flow.createNode(ProbeNode::new);
        ProbeNode idle = flow.createNode(ProbeNode::new);
        flow.connectNodes(a, 0, sum, 0);
        flow.connectNodes(b, 0, sum, 1);
        flow.connectNodes(sum, 0, probe, 0);
        probe.reset();

        assertEquals(GraphActionResponse.SUCCESS, player.play());

        assertEquals(List.of(12.0), probe.history());
        assertEquals(0, idle.updates());
        assertEquals(GraphState.STOPPED, player.state());
        assertTrue(flow.executor() instanceof DataFlowNaive);
        assertEquals(List.of(a, b, sum, probe), player.activeNodes());
        assertEquals(List.of(a, b), player.rootNodes());
        assertTrue(player.frameNodes().isEmpty());
        assertFalse(flow.isTraversing());
    }

    @Test
    public void testStopFromObserverEndsAfterThatFrame() {
        CounterFrameNode counter = flow.createNode(f -> new CounterFrameNode(f, 10));
        ProbeNode probe = flow.createNode(ProbeNode::new);
        flow.connectNodes(counter, 0, probe, 0);
        probe.reset();
        probe.onValue(v -> {
            if (Integer.valueOf(4).equals(v))
                player.stop();
        });

        player.play();

        assertEquals(4, player.graphTime().frameCount());
        assertEquals(List.of(1, 2, 3, 4), probe.history());
        assertEquals(GraphState.STOPPED, player.state());
        assertTrue(player.graphTime().time() > 0);
    }

    @Test
    public void testEndsWhenFrameNodesFinish() {
        CounterFrameNode counter = flow.createNode(f -> new CounterFrameNode(f, 3));
        ProbeNode probe = flow.createNode(ProbeNode::new);
        flow.connectNodes(counter, 0, probe, 0);
        probe.reset();

        player.play();

        assertEquals(3, player.graphTime().frameCount());
        assertEquals(List.of(1, 2, 3), probe.history());
        assertTrue(counter.isFinished());

        // time is kept after stop and reset by the next play
        player.play();
        assertEquals(3, player.graphTime().frameCount());
        assertEquals(List.of(1, 2, 3, 1, 2, 3), probe.history());
    }

    @Test
    public void testLoneFrameNodeIsActive() {
        CounterFrameNode counter = flow.createNode(f -> new CounterFrameNode(f, 2));

        player.play();

        assertEquals(List.of(counter), player.frameNodes());
        assertEquals(2, counter.count());
    }

    @Test
    public void testPauseNotAllowedWithoutFrameNodes() {
        ValueNode v = flow.createNode(f -> new ValueNode(f, 1));
        ProbeNode probe = flow.createNode(ProbeNode::new);
        flow.connectNodes(v, 0, probe, 0);
        GraphActionResponse[] response = new GraphActionResponse[1];
        probe.onValue(x -> response[0] = player.pause());

        player.play();

        assertEquals(GraphActionResponse.NOT_ALLOWED, response[0]);
    }

    @Test
    public void testPauseResumeStopAsync() throws Exception {
        CounterFrameNode counter = flow.createNode(f -> new CounterFrameNode(f, 100_000));
        Hooks hooks = flow.createNode(Hooks::new);
        flow.connectNodes(counter, 0, hooks, 0);

        assertEquals(GraphActionResponse.SUCCESS, player.playAsync(pool));
        assertEquals(GraphState.PLAYING, player.state());
        assertTrue(flow.executor() instanceof ManualFlow);
        assertEquals(GraphActionResponse.NOT_ALLOWED, player.play());
        assertFalse(player.setFrames(10));
        waitFor(() -> counter.count() > 2);

        assertEquals(GraphActionResponse.SUCCESS, player.pause());
        assertEquals(GraphState.PAUSED, player.state());
        assertEquals(GraphActionResponse.NOT_ALLOWED, player.pause());
        TimeUnit.MILLISECONDS.sleep(50);
        int frozen = counter.count();
        TimeUnit.MILLISECONDS.sleep(100);
        assertEquals(frozen, counter.count());
        assertEquals(1, hooks.pauses);

        assertEquals(GraphActionResponse.SUCCESS, player.resume());
        assertEquals(GraphActionResponse.NOT_ALLOWED, player.resume());
        waitFor(() -> counter.count() > frozen);

        assertEquals(GraphActionResponse.SUCCESS, player.stop());
        assertTrue(player.awaitState(GraphState.STOPPED, 2_000));
        assertEquals(1, hooks.inits);
        assertEquals(1, hooks.stops);
        assertTrue(flow.executor() instanceof DataFlowNaive);
        assertEquals(GraphActionResponse.NOT_ALLOWED, player.stop());
        assertTrue(player.setFrames(10));
    }

    @Test
    public void testNodeErrorsDoNotStopThePlayer() {
        ErrorCollector errors = new ErrorCollector();
        flow.addListener(errors);
        CounterFrameNode counter = flow.createNode(f -> new CounterFrameNode(f, 3));
        Failing failing = flow.createNode(Failing::new);
        flow.connectNodes(counter, 0, failing, 0);
        errors.nodes.clear();

        player.play();

        assertEquals(3, player.graphTime().frameCount());
        assertEquals(List.of(failing, failing, failing), errors.nodes);
    }

    @Test
    public void testNoFlow() {
        FlowPlayer detached = new FlowPlayer();
        assertEquals(GraphActionResponse.NO_GRAPH, detached.play());
        assertEquals(GraphActionResponse.NO_GRAPH, detached.pause());
        assertEquals(GraphActionResponse.NO_GRAPH, detached.stop());
        assertEquals(FlowPlayer.DEFAULT_FRAMES, detached.graphTime().frames());
    }

    @Test
    public void testSetFlowStopsRunningPlayer() throws Exception {
        flow.createNode(f -> new CounterFrameNode(f, 100_000));
        player.playAsync(pool);

        Flow other = new Flow("other");
        player.setFlow(other);

        assertEquals(GraphState.STOPPED, player.state());
        assertSame(other, player.flow());
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (!condition.getAsBoolean()) {
            assertTrue("condition not met in time", System.currentTimeMillis() < deadline);
            TimeUnit.MILLISECONDS.sleep(5);
        }
    }
}

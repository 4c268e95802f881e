package com.nodeflow.wiring;

import com.nodeflow.engine.Flow;
import com.nodeflow.node.CounterFrameNode;
import com.nodeflow.node.ProbeNode;
import com.nodeflow.node.ValueNode;
import com.lmax.disruptor.dsl.ProducerType;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

public class FlowEventBusTest {

    @Test
    public void testAppliesEventsInOrder() {
        Flow flow = new Flow("bus");
        ValueNode v = flow.createNode(f -> new ValueNode(f, 0));
        ProbeNode probe = flow.createNode(ProbeNode::new);
        flow.connectNodes(v, 0, probe, 0);
        probe.reset();

        FlowEventBus bus = new FlowEventBus(flow, 64, ProducerType.SINGLE).start();
        bus.publishOutput(0, 0, 10);
        bus.publishOutput(0, 0, 20);
        bus.publishUpdate(1, -1);
        bus.publishUpdate(5, -1);
        bus.close();

        assertEquals(List.of(10, 20, 20), probe.history());
        assertEquals(3, bus.handler().processed());
        assertEquals(1, bus.handler().rejected());
    }

    @Test
    public void testManyProducers() throws Exception {
        Flow flow = new Flow("producers");
        ValueNode v = flow.createNode(f -> new ValueNode(f, 0));
        ProbeNode probe = flow.createNode(ProbeNode::new);
        flow.connectNodes(v, 0, probe, 0);
        probe.reset();
        AtomicLong lastBatch = new AtomicLong();

        FlowEventBus bus = new FlowEventBus(flow).start();
        bus.handler().setBatchCallback((seq, total) -> lastBatch.set(total));
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            int base = t * 1000;
            new Thread(() -> {
                for (int i = 0; i < 250; i++)
                    bus.publishOutput(0, 0, base + i);
                done.countDown();
            }).start();
        }
        done.await();
        bus.close();

        assertEquals(1000, probe.updates());
        assertEquals(1000, bus.handler().processed());
        assertEquals(1000, lastBatch.get());
    }

    @Test
    public void testTypeMismatchIsRejected() {
        Flow flow = new Flow("typed");
        flow.createNode(f -> new CounterFrameNode(f, 1));

        FlowEventBus bus = new FlowEventBus(flow).start();
        bus.publishOutput(0, 0, "one");
        bus.close();

        assertEquals(1, bus.handler().rejected());
    }

    @Test
    public void testMustBeStarted() {
        FlowEventBus bus = new FlowEventBus(new Flow("idle"));
        assertThrows(IllegalStateException.class, () -> bus.publishUpdate(0, -1));
        bus.start();
        assertEquals(0.0, bus.backlogPercent(), 0.0);
        assertThrows(IllegalStateException.class, bus::start);
        bus.close();
        bus.close();
    }
}

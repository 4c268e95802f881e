package com.nodeflow.node;

import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.TypeRegistry;

import java.util.List;
import java.util.Map;

/**
 * Frame-driven source emitting 1, 2, 3, ... once per tick, for a configured
 * number of frames, then finishing.
 */
public class CounterFrameNode extends AbstractFrameNode {
    public static final String FRAMES = "frames";

    private final int frames;
    private volatile int count;

    public CounterFrameNode(Flow flow, int frames) {
        super(flow, "counter", List.of(), List.of(PortConfig.data("frame", TypeRegistry.INTEGER)));
        if (frames < 1)
            throw new IllegalArgumentException("frames must be positive: " + frames);
        this.frames = frames;
        setProperty(FRAMES, frames);
    }

    public static CounterFrameNode fromProperties(Flow flow, Map<String, Object> properties) {
        Object n = properties.get(FRAMES);
        return new CounterFrameNode(flow, n instanceof Number num ? num.intValue() : 1);
    }

    @Override
    public void init() {
        super.init();
        count = 0;
    }

    @Override
    public void frameUpdateEvent() {
        int c = ++count;
        setOutput(0, c);
        if (c >= frames)
            finish();
    }

    /** Frames emitted since the last init. */
    public int count() {
        return count;
    }

    public int frames() {
        return frames;
    }
}

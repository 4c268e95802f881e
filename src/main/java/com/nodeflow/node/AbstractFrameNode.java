package com.nodeflow.node;

import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;

import java.util.List;

/**
 * Base class for frame-driven nodes.
 *
 * A player calls {@link #frameUpdateEvent()} once per tick until the node
 * reports itself finished. {@link #init()} clears the finished flag, so the
 * node runs again on the next play.
 */
public abstract class AbstractFrameNode extends AbstractNode {
    private volatile boolean finished;

    protected AbstractFrameNode(Flow flow, String title, List<PortConfig> initInputs, List<PortConfig> initOutputs) {
        super(flow, title, initInputs, initOutputs);
    }

    @Override
    public final boolean isFrameDriven() {
        return true;
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    /** Tells the player this node has no more frames to produce. */
    protected void finish() {
        finished = true;
    }

    @Override
    public void init() {
        finished = false;
    }

    @Override
    public void updateEvent(int input) {
        // Frame nodes work in frameUpdateEvent.
    }
}

package com.nodeflow.player;

import com.nodeflow.engine.Flow;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives a flow like a program: evaluates it once, then, if it contains
 * frame-driven nodes, keeps ticking it at a target frame rate until stopped.
 *
 * States: STOPPED, PLAYING, PAUSED. Transitions are synchronized on the
 * player; each one emits the event of the entered state followed by the
 * general state-changed event (see {@link GraphEvents}).
 *
 * Subclasses implement {@link #begin()}, the synchronous STOPPED to PLAYING
 * transition, and {@link #run()}, the loop itself, which must leave the player
 * STOPPED when it returns.
 */
public abstract class GraphPlayer {
    protected final GraphTime graphTime;
    protected final GraphEvents events = new GraphEvents();

    private volatile GraphState state = GraphState.STOPPED;
    private volatile Flow flow;
    private volatile Thread runner;

    protected GraphPlayer(int frames) {
        this.graphTime = new GraphTime(frames);
    }

    public Flow flow() {
        return flow;
    }

    /**
     * Attaches the player to a flow, stopping it first if it plays another one.
     *
     * @throws IllegalStateException if called from the player's own loop, or if
     *                               the player did not stop within a few seconds
     */
    public void setFlow(Flow flow) {
        if (state != GraphState.STOPPED) {
            if (Thread.currentThread() == runner)
                throw new IllegalStateException("Cannot reattach a player from inside its own loop");
            stop();
            if (!awaitState(GraphState.STOPPED, 5_000))
                throw new IllegalStateException("Player did not stop in time");
        }
        synchronized (this) {
            this.flow = flow;
        }
    }

    public GraphState state() {
        return state;
    }

    public GraphTime graphTime() {
        return graphTime;
    }

    /** Convenience for {@code graphTime().deltaTime()}. */
    public double deltaTime() {
        return graphTime.deltaTime();
    }

    public GraphEvents events() {
        return events;
    }

    /**
     * Sets the target frame rate.
     *
     * @return false, leaving the rate unchanged, unless the player is stopped
     */
    public synchronized boolean setFrames(int frames) {
        if (state != GraphState.STOPPED)
            return false;
        graphTime.setFrames(frames);
        return true;
    }

    /** Plays the flow on the calling thread and returns once the player stopped. */
    public final GraphActionResponse play() {
        GraphActionResponse r = begin();
        if (r == GraphActionResponse.SUCCESS)
            runLoop();
        return r;
    }

    /**
     * Enters PLAYING on the calling thread and runs the loop on the executor.
     * The response reflects the state check only.
     */
    public final GraphActionResponse playAsync(Executor executor) {
        GraphActionResponse r = begin();
        if (r != GraphActionResponse.SUCCESS)
            return r;
        try {
            executor.execute(this::runLoop);
        } catch (RejectedExecutionException e) {
            halt();
            throw e;
        }
        return r;
    }

    private void runLoop() {
        runner = Thread.currentThread();
        try {
            run();
        } finally {
            runner = null;
        }
    }

    /** Pauses the loop. Only possible while playing a flow with frame-driven nodes. */
    public abstract GraphActionResponse pause();

    public abstract GraphActionResponse resume();

    /** Requests a stop; honored at the next tick or pass boundary. */
    public abstract GraphActionResponse stop();

    /** STOPPED to PLAYING, run on the calling thread. */
    protected abstract GraphActionResponse begin();

    /** The play loop. Must leave the player STOPPED. */
    protected abstract void run();

    /** Returns to STOPPED after {@link #begin()} succeeded but the loop never ran. */
    protected abstract void halt();

    protected final synchronized void transition(GraphState next) {
        GraphState old = state;
        state = next;
        notifyAll();
        events.emit(old, next);
    }

    /**
     * Waits until the player reaches the state.
     *
     * @return false on timeout or interrupt
     */
    public final synchronized boolean awaitState(GraphState expected, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (state != expected) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0)
                return false;
            try {
                wait(left);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }
}

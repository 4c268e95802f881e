package com.nodeflow.api;

import java.util.List;
import java.util.Map;

/**
 * A computational vertex of a flow.
 *
 * Every node, whether it produces data, transforms it or consumes it,
 * implements this interface. The only callback a node must implement is
 * {@link #updateEvent(int)}; all lifecycle hooks are no-ops by default.
 *
 * Key Responsibilities:
 *
 * 1. Identity: a process-unique id handed out by the flow's id counter, a
 * human-readable title, and a type identifier used to re-create the node when a
 * flow is loaded.
 *
 * 2. Ports: ordered input and output lists. Ports are addressed by index by
 * executors, by the player and by the structural export.
 *
 * 3. Computation: {@link #updateEvent(int)} contains the node's logic. It is
 * invoked by the flow's active executor, never directly by user code.
 *
 * Threading:
 * All callbacks run synchronously on the thread driving the current execution
 * or player pass. Long-running work is the node's own responsibility.
 */
public interface Node {

    /** Process-unique identity of this node. */
    long id();

    /** Human-readable title, used for logging and diagnostics. */
    String title();

    /**
     * Type identifier under which the node's factory is registered.
     * Defaults to the simple class name.
     */
    default String identifier() {
        return getClass().getSimpleName();
    }

    /** Ordered input ports. The returned list is read-only. */
    List<NodeInput> inputs();

    /** Ordered output ports. The returned list is read-only. */
    List<NodeOutput> outputs();

    /** Optional configuration of the node. Persisted with the flow. */
    default Map<String, Object> properties() {
        return Map.of();
    }

    /**
     * Frame-driven nodes are evaluated once per player tick through
     * {@link #frameUpdateEvent()}.
     */
    default boolean isFrameDriven() {
        return false;
    }

    /** A frame-driven node reports completion here; the player stops ticking it. */
    default boolean isFinished() {
        return false;
    }

    /**
     * Main processing callback.
     *
     * Called when an input received data or a trigger, when the node was
     * updated explicitly, or, in exec mode, when a successor requests this
     * node's output data.
     *
     * @param input index of the input that triggered the update, or -1 if the
     *              update was not caused by an input
     */
    void updateEvent(int input);

    /** Called every time the node is placed in a flow, including re-adds after removal. */
    default void placeEvent() {
    }

    /** Called when the node is removed from its flow. */
    default void removeEvent() {
    }

    /** Called by a player on every active node before the first pass. */
    default void init() {
    }

    /** Called by a player when it pauses. */
    default void pause() {
    }

    /** Called by a player when it stops. */
    default void stop() {
    }

    /** Called once per player tick on unfinished frame-driven nodes. */
    default void frameUpdateEvent() {
    }
}

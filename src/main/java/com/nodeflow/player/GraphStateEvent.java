package com.nodeflow.player;

import lombok.Getter;

/** A player state transition. */
@Getter
public final class GraphStateEvent {
    private final GraphState oldState;
    private final GraphState newState;

    public GraphStateEvent(GraphState oldState, GraphState newState) {
        this.oldState = oldState;
        this.newState = newState;
    }

    @Override
    public String toString() {
        return oldState + " -> " + newState;
    }
}

package com.nodeflow.player;

/** State of a graph player. */
public enum GraphState {
    PLAYING,
    PAUSED,
    STOPPED
}

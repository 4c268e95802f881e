package com.nodeflow.player;

/** Answer to a play, pause, resume or stop request. */
public enum GraphActionResponse {
    /** There is no flow to act on. */
    NO_GRAPH,
    /** The action is not allowed in the player's current state. */
    NOT_ALLOWED,
    SUCCESS
}

package com.nodeflow.player;

import com.nodeflow.util.Event;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Events of a graph player.
 *
 * Every transition emits the event of the state entered, then the general
 * state-changed event. Per-state events can be addressed by {@link GraphState}
 * or by the action names {@code play}, {@code pause} and {@code stop}.
 */
public final class GraphEvents {
    private final Event<GraphStateEvent> stateChanged = new Event<>();
    private final Map<GraphState, Event<GraphStateEvent>> byState = new EnumMap<>(GraphState.class);

    public GraphEvents() {
        for (GraphState s : GraphState.values())
            byState.put(s, new Event<>());
    }

    public void subscribeStateChanged(Consumer<? super GraphStateEvent> callback) {
        stateChanged.subscribe(callback);
    }

    public void subscribeStateChanged(Consumer<? super GraphStateEvent> callback, int priority, boolean oneOff) {
        stateChanged.subscribe(callback, priority, oneOff);
    }

    public boolean unsubscribeStateChanged(Consumer<? super GraphStateEvent> callback) {
        return stateChanged.unsubscribe(callback);
    }

    public void subscribe(GraphState state, Consumer<? super GraphStateEvent> callback) {
        byState.get(state).subscribe(callback);
    }

    public void subscribe(GraphState state, Consumer<? super GraphStateEvent> callback, int priority, boolean oneOff) {
        byState.get(state).subscribe(callback, priority, oneOff);
    }

    /** @param action {@code play}, {@code pause} or {@code stop} */
    public void subscribe(String action, Consumer<? super GraphStateEvent> callback) {
        subscribe(stateOf(action), callback);
    }

    public boolean unsubscribe(GraphState state, Consumer<? super GraphStateEvent> callback) {
        return byState.get(state).unsubscribe(callback);
    }

    public boolean unsubscribe(String action, Consumer<? super GraphStateEvent> callback) {
        return unsubscribe(stateOf(action), callback);
    }

    /** Drops every subscriber. */
    public void reset() {
        stateChanged.clear();
        byState.values().forEach(Event::clear);
    }

    void emit(GraphState oldState, GraphState newState) {
        GraphStateEvent e = new GraphStateEvent(oldState, newState);
        byState.get(newState).emit(e);
        stateChanged.emit(e);
    }

    static GraphState stateOf(String action) {
        switch (action.toLowerCase(Locale.ROOT)) {
            case "play":
                return GraphState.PLAYING;
            case "pause":
                return GraphState.PAUSED;
            case "stop":
                return GraphState.STOPPED;
            default:
                throw new IllegalArgumentException("Unknown player event: " + action);
        }
    }
}

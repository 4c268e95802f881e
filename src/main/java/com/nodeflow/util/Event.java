package com.nodeflow.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Observer list with priorities.
 *
 * Subscribers are called in ascending priority order; subscribers with equal
 * priority are called in registration order. User code may use priorities
 * {@value #MIN_USER_PRIORITY} to {@value #MAX_PRIORITY}. Negative priorities,
 * down to {@value #MIN_INTERNAL_PRIORITY}, are reserved for the engine's own
 * subscribers and are only accepted by {@link #subscribeInternal}.
 *
 * Emission iterates over a snapshot, so callbacks may subscribe or unsubscribe
 * while an event is being emitted.
 *
 * @param <T> payload type
 */
public final class Event<T> {
    public static final int MIN_INTERNAL_PRIORITY = -5;
    public static final int MIN_USER_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;

    private static final class Slot<T> {
        final Consumer<? super T> callback;
        final int priority;
        final boolean oneOff;

        Slot(Consumer<? super T> callback, int priority, boolean oneOff) {
            this.callback = callback;
            this.priority = priority;
            this.oneOff = oneOff;
        }
    }

    // Kept sorted by priority, stable by registration time.
    private final List<Slot<T>> slots = new ArrayList<>();

    public void subscribe(Consumer<? super T> callback) {
        subscribe(callback, MIN_USER_PRIORITY, false);
    }

    public void subscribe(Consumer<? super T> callback, int priority) {
        subscribe(callback, priority, false);
    }

    /**
     * @param callback subscriber, must not already be registered
     * @param priority {@value #MIN_USER_PRIORITY}..{@value #MAX_PRIORITY}, lower is earlier
     * @param oneOff   if true the subscriber is removed after its first call
     */
    public void subscribe(Consumer<? super T> callback, int priority, boolean oneOff) {
        if (priority < MIN_USER_PRIORITY || priority > MAX_PRIORITY)
            throw new IllegalArgumentException("Priority must be in [" + MIN_USER_PRIORITY + ", " + MAX_PRIORITY
                    + "], was " + priority);
        insert(new Slot<>(callback, priority, oneOff));
    }

    /**
     * Registers an engine subscriber that must run before every user subscriber.
     * Not meant for application code.
     */
    public void subscribeInternal(Consumer<? super T> callback, int priority) {
        if (priority < MIN_INTERNAL_PRIORITY || priority >= MIN_USER_PRIORITY)
            throw new IllegalArgumentException("Internal priority must be in [" + MIN_INTERNAL_PRIORITY + ", "
                    + MIN_USER_PRIORITY + "), was " + priority);
        insert(new Slot<>(callback, priority, false));
    }

    private synchronized void insert(Slot<T> slot) {
        for (Slot<T> s : slots) {
            if (s.callback == slot.callback)
                throw new IllegalArgumentException("Callback already subscribed");
        }
        int i = slots.size();
        while (i > 0 && slots.get(i - 1).priority > slot.priority)
            i--;
        slots.add(i, slot);
    }

    /** @return true if the callback was registered */
    public synchronized boolean unsubscribe(Consumer<? super T> callback) {
        return slots.removeIf(s -> s.callback == callback);
    }

    public synchronized void clear() {
        slots.clear();
    }

    public synchronized int subscriberCount() {
        return slots.size();
    }

    public void emit(T payload) {
        List<Slot<T>> snapshot;
        synchronized (this) {
            if (slots.isEmpty())
                return;
            snapshot = new ArrayList<>(slots);
            slots.removeIf(s -> s.oneOff);
        }
        for (Slot<T> s : snapshot)
            s.callback.accept(payload);
    }
}

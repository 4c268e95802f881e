package com.nodeflow.util;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.Assert.*;

public class EventTest {

    @Test
    public void testPriorityThenRegistrationOrder() {
        Event<String> event = new Event<>();
        List<String> calls = new ArrayList<>();
        event.subscribe(s -> calls.add("late"), 5);
        event.subscribe(s -> calls.add("first"));
        event.subscribe(s -> calls.add("second"));
        event.subscribeInternal(s -> calls.add("engine"), -1);

        event.emit("x");

        assertEquals(List.of("engine", "first", "second", "late"), calls);
    }

    @Test
    public void testOneOffSubscriberRunsOnce() {
        Event<Integer> event = new Event<>();
        List<Integer> seen = new ArrayList<>();
        event.subscribe(seen::add, 0, true);

        event.emit(1);
        event.emit(2);

        assertEquals(List.of(1), seen);
        assertEquals(0, event.subscriberCount());
    }

    @Test
    public void testCallbacksMayUnsubscribeWhileEmitting() {
        Event<Integer> event = new Event<>();
        List<Integer> seen = new ArrayList<>();
        Consumer<Integer>[] self = new Consumer[1];
        self[0] = v -> {
            seen.add(v);
            event.unsubscribe(self[0]);
        };
        event.subscribe(self[0]);

        event.emit(1);
        event.emit(2);

        assertEquals(List.of(1), seen);
    }

    @Test
    public void testRejectsBadPrioritiesAndDuplicates() {
        Event<String> event = new Event<>();
        Consumer<String> cb = s -> {
        };
        assertThrows(IllegalArgumentException.class, () -> event.subscribe(cb, -1));
        assertThrows(IllegalArgumentException.class, () -> event.subscribe(cb, Event.MAX_PRIORITY + 1));
        assertThrows(IllegalArgumentException.class, () -> event.subscribeInternal(cb, 0));

        event.subscribe(cb);
        assertThrows(IllegalArgumentException.class, () -> event.subscribe(cb, 3));
        assertTrue(event.unsubscribe(cb));
        assertFalse(event.unsubscribe(cb));
    }
}

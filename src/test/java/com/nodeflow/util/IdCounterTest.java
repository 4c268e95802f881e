package com.nodeflow.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class IdCounterTest {

    @Test
    public void testIssuesAscendingIds() {
        IdCounter ids = new IdCounter();
        assertEquals(0, ids.next());
        assertEquals(1, ids.next());
        assertEquals(1, ids.current());
    }

    @Test
    public void testAdvance() {
        IdCounter ids = new IdCounter(9);
        ids.advanceTo(20);
        assertEquals(21, ids.next());
        ids.advanceTo(21);
        assertThrows(IllegalArgumentException.class, () -> ids.advanceTo(5));
        assertEquals(22, ids.next());
    }
}

package com.nodeflow.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Ascending id counter.
 *
 * One instance is meant to be shared by every flow of an application (the
 * session creates it and hands it to its flows and loads), which makes ids
 * unique for the lifetime of the process without a hidden global.
 */
public final class IdCounter {
    private final AtomicLong counter;

    public IdCounter() {
        this(-1);
    }

    /** @param last the last id considered taken; the first id issued is {@code last + 1} */
    public IdCounter(long last) {
        this.counter = new AtomicLong(last);
    }

    /** Returns a fresh id. */
    public long next() {
        return counter.incrementAndGet();
    }

    /** The last id issued. */
    public long current() {
        return counter.get();
    }

    /**
     * Moves the counter forward so no id up to {@code last} is issued again.
     *
     * @throws IllegalArgumentException if this would move the counter backwards
     */
    public void advanceTo(long last) {
        long cur;
        do {
            cur = counter.get();
            if (last < cur)
                throw new IllegalArgumentException("Decreasing id counters is illegal: " + last + " < " + cur);
        } while (!counter.compareAndSet(cur, last));
    }
}

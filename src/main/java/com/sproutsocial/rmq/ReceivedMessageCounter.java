package com.sproutsocial.rmq;

import net.jcip.annotations.ThreadSafe;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts messages handed to the receive queue. Never decremented.
 */
@ThreadSafe
public final class ReceivedMessageCounter {

    private final AtomicLong count = new AtomicLong();

    public long increment() {
        return count.incrementAndGet();
    }

    public long getValue() {
        return count.get();
    }

    @Override
    public String toString() {
        return Long.toString(count.get());
    }

}

package com.sproutsocial.rmq;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO between two pipeline stages. Any number of producers, one consumer.
 * Once closed no more elements are accepted and the consumer sees {@code null}
 * after draining what was already queued.
 */
@ThreadSafe
public class HandoffQueue<T> {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<Object>();
    private final String name;

    @GuardedBy("this")
    private boolean closed = false;

    //only written by the consumer thread
    private volatile boolean drained = false;

    public HandoffQueue(String name) {
        this.name = name;
    }

    /**
     * @return false if the queue was already closed and the element was not accepted
     */
    public synchronized boolean put(T element) {
        if (closed) {
            return false;
        }
        queue.add(element);
        return true;
    }

    /**
     * Idempotent. The end marker goes in under the same lock as {@link #put}, nothing can land behind it.
     */
    public synchronized boolean close() {
        if (closed) {
            return false;
        }
        closed = true;
        queue.add(END);
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Blocks until an element is available.
     * @return the next element, or null once the queue is closed and empty
     */
    @SuppressWarnings("unchecked")
    public T take() throws InterruptedException {
        if (drained) {
            return null;
        }
        Object next = queue.take();
        if (next == END) {
            drained = true;
            return null;
        }
        return (T) next;
    }

    /**
     * Elements waiting, not counting the end marker.
     */
    public int size() {
        int size = queue.size();
        return isClosed() && !drained ? Math.max(size - 1, 0) : size;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return String.format("HandoffQueue:%s size:%d closed:%s", name, size(), isClosed());
    }

}

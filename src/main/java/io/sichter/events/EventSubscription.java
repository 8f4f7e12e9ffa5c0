package io.sichter.events;

import io.sichter.model.Event;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-reader view of the live event stream.
 *
 * <p>The buffer is bounded: when a reader falls behind, the oldest buffered event is dropped
 * so {@link #offer(Event)} never blocks the writer. Dropped events are counted and reported
 * through {@link #drainDropped()}.
 */
public final class EventSubscription implements AutoCloseable {
    private final EventLog owner;
    private final List<Event> replay;
    private final int capacity;
    private final ArrayDeque<Event> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private long lastOfferedSeq;
    private long dropped;
    private boolean closed;

    EventSubscription(EventLog owner, List<Event> replay, long startAfterSeq, int capacity) {
        this.owner = owner;
        this.replay = List.copyOf(replay);
        this.capacity = Math.max(1, capacity);
        this.buffer = new ArrayDeque<>(this.capacity);
        this.lastOfferedSeq = startAfterSeq;
    }

    public List<Event> replay() {
        return replay;
    }

    void offer(Event event) {
        lock.lock();
        try {
            if (closed || event.seq() <= lastOfferedSeq) {
                return;
            }
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
                dropped++;
            }
            buffer.addLast(event);
            lastOfferedSeq = event.seq();
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public Event poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (buffer.isEmpty() && !closed) {
                if (remaining <= 0L) {
                    return null;
                }
                remaining = available.awaitNanos(remaining);
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public long drainDropped() {
        lock.lock();
        try {
            long out = dropped;
            dropped = 0L;
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int buffered() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            buffer.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        owner.unsubscribe(this);
    }
}

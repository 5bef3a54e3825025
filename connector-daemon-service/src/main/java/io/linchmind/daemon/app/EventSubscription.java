package io.linchmind.daemon.app;

import io.linchmind.connector.model.LifecycleEvent;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded per-subscriber queue. When full, the oldest event is dropped to make room.
 */
public final class EventSubscription implements AutoCloseable {

    private final String name;
    private final int capacity;
    private final ArrayDeque<LifecycleEvent> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();
    private final Consumer<EventSubscription> onClose;
    private volatile boolean closed;

    EventSubscription(String name, int capacity, Consumer<EventSubscription> onClose) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    public String name() {
        return name;
    }

    void offer(LifecycleEvent event) {
        if (closed) {
            return;
        }
        lock.lock();
        try {
            if (queue.size() >= capacity) {
                queue.pollFirst();
                dropped.incrementAndGet();
            }
            queue.addLast(event);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next event, or {@code null} when none arrived within {@code timeout} or the subscription closed.
     */
    public LifecycleEvent poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (closed || remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.accept(this);
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}

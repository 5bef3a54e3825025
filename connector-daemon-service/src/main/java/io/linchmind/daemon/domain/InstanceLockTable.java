package io.linchmind.daemon.domain;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion. Keys are instance ids, or {@code type:<typeId>} for creation.
 * Locks are reentrant so a composite operation (restart) can nest its steps.
 */
public final class InstanceLockTable {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public static String typeKey(String typeId) {
        return "type:" + typeId;
    }

    /**
     * Drops the lock of a removed instance. Callers hold the lock.
     */
    public void forget(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread() && !lock.hasQueuedThreads()) {
            locks.remove(key, lock);
        }
    }

    int size() {
        return locks.size();
    }
}

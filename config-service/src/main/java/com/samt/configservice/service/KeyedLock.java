package com.samt.configservice.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion per key. Locks exist only while held or awaited.
 */
public class KeyedLock {

    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map bin of its key
        private int users;
    }

    private final ConcurrentHashMap<String, Holder> holders = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Holder holder = holders.compute(key, (k, existing) -> {
            Holder h = existing != null ? existing : new Holder();
            h.users++;
            return h;
        });
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            holders.computeIfPresent(key, (k, h) -> --h.users == 0 ? null : h);
        }
    }

    int activeKeys() {
        return holders.size();
    }
}

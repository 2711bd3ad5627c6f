package com.openforge.mnemo.memory;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per user id. Guards the read-modify-write of access counters during
 * retrieval and serializes forgetting cycles for the same user.
 */
@Component
public class UserLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String userId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String userId, Runnable action) {
        withLock(userId, () -> {
            action.run();
            return null;
        });
    }
}

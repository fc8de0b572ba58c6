package com.ai.tarot.service;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per user id, created on demand and dropped once nobody holds or waits for it.
 * Turns of different users never contend.
 */
@Component
public class UserLockRegistry {

    private final Map<String, CountedLock> locks = new ConcurrentHashMap<>();

    /**
     * Waits up to {@code timeout} for the user's lock. Returns a handle to release, or
     * {@code null} if the wait timed out.
     */
    public Handle tryLock(String userId, Duration timeout) throws InterruptedException {
        CountedLock lock = locks.compute(userId, (k, existing) -> {
            CountedLock l = existing == null ? new CountedLock() : existing;
            l.users++;
            return l;
        });
        boolean acquired = false;
        try {
            acquired = lock.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            if (!acquired) {
                release(userId);
            }
        }
        return acquired ? new Handle(userId, lock) : null;
    }

    int size() {
        return locks.size();
    }

    private void release(String userId) {
        locks.computeIfPresent(userId, (k, l) -> --l.users == 0 ? null : l);
    }

    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    public final class Handle implements AutoCloseable {
        private final String userId;
        private final CountedLock lock;

        private Handle(String userId, CountedLock lock) {
            this.userId = userId;
            this.lock = lock;
        }

        @Override
        public void close() {
            lock.lock.unlock();
            release(userId);
        }
    }
}

package com.rico.insurance.enrichment;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per USDOT so overlapping enrichments of the same carrier run one after the other, while
 * different carriers proceed in parallel.
 */
@Component
public class CarrierLockRegistry {

    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long usdot, Supplier<T> work) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(usdot, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(usdot) != lock) {
                // evicted while we waited; take the current one
                lock.unlock();
                continue;
            }
            try {
                return work.get();
            } finally {
                lock.unlock();
                locks.computeIfPresent(usdot, (k, l) -> l.isLocked() || l.hasQueuedThreads() ? l : null);
            }
        }
    }

    int size() {
        return locks.size();
    }

    boolean isLocked(Long usdot) {
        ReentrantLock lock = locks.get(usdot);
        return lock != null && lock.isLocked();
    }
}

package com.flagship.fundraising_ledger.recalc;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per summary node. A second recompute of the same node
 * waits for the first to finish; different nodes proceed in parallel.
 *
 * A lock exists only while some thread holds or waits for it. Holders are
 * counted inside {@link ConcurrentMap#compute}, and the last one to leave
 * removes the entry.
 */
@Component
public class RecomputeLocks {

    private final ConcurrentMap<RecomputeKey, CountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(RecomputeKey key, Supplier<T> work) {
        CountedLock counted = locks.compute(key, (k, existing) -> {
            CountedLock lock = existing != null ? existing : new CountedLock();
            lock.holders++;
            return lock;
        });
        counted.lock.lock();
        try {
            return work.get();
        } finally {
            counted.lock.unlock();
            locks.compute(key, (k, existing) -> --existing.holders == 0 ? null : existing);
        }
    }

    int size() {
        return locks.size();
    }

    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per-key compute
        private int holders;
    }
}

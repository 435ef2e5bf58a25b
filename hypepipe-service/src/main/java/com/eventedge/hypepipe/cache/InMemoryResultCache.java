package com.eventedge.hypepipe.cache;

import com.eventedge.hypepipe.capability.CapabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Single-process {@link ResultCache} backed by one map and one lock.
 *
 * <p>Staleness is checked at read time and entries are replaced on the next write;
 * there is no background eviction. Key cardinality is bounded by the small set of
 * valid inputs per capability. Only the get/put critical sections hold the lock,
 * never handler execution.
 */
public class InMemoryResultCache implements ResultCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultCache.class);

    private final Map<String, CacheEntry> store = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final LongSupplier nanoClock;

    public InMemoryResultCache() {
        this(System::nanoTime);
    }

    /**
     * @param nanoClock monotonic time source in nanoseconds
     */
    public InMemoryResultCache(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    @Override
    public Optional<CacheEntry> get(String key, Duration maxAge) {
        if (maxAge.isZero() || maxAge.isNegative()) {
            return Optional.empty();
        }
        CacheEntry entry;
        lock.lock();
        try {
            entry = store.get(key);
        } finally {
            lock.unlock();
        }
        if (entry == null) {
            return Optional.empty();
        }
        long ageNanos = nanoClock.getAsLong() - entry.capturedAtNanos();
        return ageNanos <= maxAge.toNanos() ? Optional.of(entry) : Optional.empty();
    }

    @Override
    public void put(String key, CapabilityResult result, String asof) {
        CacheEntry entry = new CacheEntry(result, asof, nanoClock.getAsLong());
        lock.lock();
        try {
            store.put(key, entry);
        } finally {
            lock.unlock();
        }
        log.debug("CACHE_REFRESH key={} asof={}", key, asof);
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            store.clear();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }
}

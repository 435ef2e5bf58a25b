package com.eventedge.hypepipe.cache;

import com.eventedge.hypepipe.capability.CapabilityResult;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed store of handler results. Freshness is decided by the caller on each read.
 */
public interface ResultCache {

    /**
     * @return the entry for {@code key} when it was captured no more than {@code maxAge} ago
     */
    Optional<CacheEntry> get(String key, Duration maxAge);

    void put(String key, CapabilityResult result, String asof);

    void clear();
}

package com.eventedge.hypepipe.cache;

import com.eventedge.hypepipe.capability.CapabilityResult;

/**
 * Immutable cache entry: the handler result, its {@code asof}, and the monotonic
 * instant it was captured. Entries are replaced wholesale, never mutated.
 */
public record CacheEntry(
    CapabilityResult result,
    String asof,
    long capturedAtNanos
) {}

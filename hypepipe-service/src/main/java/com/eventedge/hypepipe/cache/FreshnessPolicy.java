package com.eventedge.hypepipe.cache;

/**
 * Resolves the effective max age of a cached result for one request.
 *
 * <p>Callers may ask for fresher data than the capability default, never staler:
 * the override is clamped to {@code [0, defaultTtl]}, and {@code 0} forces a miss.
 */
public final class FreshnessPolicy {

    private FreshnessPolicy() {}

    /**
     * @param freshnessOverride caller's {@code opts.freshness_s}, may be {@code null}
     * @param defaultTtlSeconds capability default; {@code <= 0} disables caching
     * @return effective max age in seconds, never negative
     */
    public static long effectiveMaxAgeSeconds(Integer freshnessOverride, int defaultTtlSeconds) {
        if (defaultTtlSeconds <= 0) {
            return 0L;
        }
        if (freshnessOverride == null) {
            return defaultTtlSeconds;
        }
        return Math.max(0L, Math.min((long) freshnessOverride, defaultTtlSeconds));
    }
}

package com.eventedge.hypepipe.capability;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A named, statically registered operation exposed through the gateway.
 *
 * <p>Handlers read snapshot data and compute a derived view. They never signal
 * "data not found" as an error: missing data becomes a
 * {@link CapabilityResult#degraded degraded} result. An error signal is reserved
 * for genuinely exceptional conditions.
 */
public interface CapabilityHandler {

    /** Capability name, e.g. {@code core.asset.snapshot}. */
    String name();

    /** Default result-cache TTL; {@code 0} means the capability is never cached. */
    int defaultTtlSeconds();

    Mono<CapabilityResult> handle(Map<String, Object> input);
}

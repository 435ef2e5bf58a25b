package com.eventedge.hypepipe.capability.handler;

import com.eventedge.hypepipe.capability.CapabilityHandler;
import com.eventedge.hypepipe.capability.CapabilityResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/** {@code hypepipe.ping}: connectivity check for integrators. No scope, never cached. */
@Component
public class PingCapability implements CapabilityHandler {

    public static final String NAME = "hypepipe.ping";

    private final Clock clock;

    public PingCapability(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int defaultTtlSeconds() {
        return 0;
    }

    @Override
    public Mono<CapabilityResult> handle(Map<String, Object> input) {
        return Mono.fromSupplier(() -> CapabilityResult.ok(Map.of("pong", true), Asof.now(clock)));
    }
}

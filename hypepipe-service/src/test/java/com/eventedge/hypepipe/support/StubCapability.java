package com.eventedge.hypepipe.support;

import com.eventedge.hypepipe.capability.CapabilityHandler;
import com.eventedge.hypepipe.capability.CapabilityResult;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Side-effect-counting handler. */
public class StubCapability implements CapabilityHandler {

    private final String name;
    private final int ttlSeconds;
    private final Function<Map<String, Object>, Mono<CapabilityResult>> body;
    private final AtomicInteger invocations = new AtomicInteger();

    public StubCapability(String name, int ttlSeconds, Function<Map<String, Object>, Mono<CapabilityResult>> body) {
        this.name       = name;
        this.ttlSeconds = ttlSeconds;
        this.body       = body;
    }

    public static StubCapability returning(String name, int ttlSeconds, Map<String, Object> data, String asof) {
        return new StubCapability(name, ttlSeconds, input -> Mono.just(CapabilityResult.ok(data, asof)));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int defaultTtlSeconds() {
        return ttlSeconds;
    }

    @Override
    public Mono<CapabilityResult> handle(Map<String, Object> input) {
        invocations.incrementAndGet();
        return body.apply(input);
    }

    public int invocations() {
        return invocations.get();
    }
}

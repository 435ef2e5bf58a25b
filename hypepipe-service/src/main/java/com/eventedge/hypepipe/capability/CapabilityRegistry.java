package com.eventedge.hypepipe.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Name → handler lookup, populated once from every {@link CapabilityHandler} bean.
 * Nothing is registered or removed after start-up.
 */
@Component
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, CapabilityHandler> handlers;

    public CapabilityRegistry(List<CapabilityHandler> handlers) {
        Map<String, CapabilityHandler> byName = new TreeMap<>();
        for (CapabilityHandler handler : handlers) {
            CapabilityHandler previous = byName.putIfAbsent(handler.name(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate capability registration: " + handler.name());
            }
        }
        this.handlers = Collections.unmodifiableMap(byName);
        log.info("Capability registry initialised. capabilities={}", this.handlers.keySet());
    }

    public Optional<CapabilityHandler> resolve(String capability) {
        return Optional.ofNullable(capability).map(handlers::get);
    }

    /** Registered names, ascending. */
    public List<String> knownCapabilities() {
        return List.copyOf(handlers.keySet());
    }

    /** Default TTL for a registered capability, {@code 0} when unknown. */
    public int defaultTtlSeconds(String capability) {
        return resolve(capability).map(CapabilityHandler::defaultTtlSeconds).orElse(0);
    }
}

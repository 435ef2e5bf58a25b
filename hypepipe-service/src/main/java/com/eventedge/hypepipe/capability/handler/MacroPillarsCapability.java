package com.eventedge.hypepipe.capability.handler;

import com.eventedge.common.supercard.SuperCard;
import com.eventedge.common.supercard.SuperCardBuilder;
import com.eventedge.hypepipe.capability.CapabilityHandler;
import com.eventedge.hypepipe.capability.CapabilityResult;
import com.eventedge.hypepipe.snapshot.MarketSnapshotLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * {@code macro.pillars}: the SuperCard for {@code input.symbol} (BTC or ETH; anything
 * else falls back to BTC).
 */
@Component
public class MacroPillarsCapability implements CapabilityHandler {

    public static final String NAME = "macro.pillars";
    static final int DEFAULT_TTL_SECONDS = 60;
    static final String NO_DATA_NOTE = "no snapshot data";

    private final MarketSnapshotLoader snapshotLoader;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MacroPillarsCapability(MarketSnapshotLoader snapshotLoader, ObjectMapper objectMapper, Clock clock) {
        this.snapshotLoader = snapshotLoader;
        this.objectMapper   = objectMapper;
        this.clock          = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int defaultTtlSeconds() {
        return DEFAULT_TTL_SECONDS;
    }

    @Override
    public Mono<CapabilityResult> handle(Map<String, Object> input) {
        Object raw = input.get("symbol");
        String symbol = SuperCardBuilder.normalizeSymbol(raw != null ? String.valueOf(raw) : null);

        return snapshotLoader.load(symbol)
            .map(snapshots -> {
                SuperCard card = SuperCardBuilder.build(snapshots);
                Map<String, Object> data = Views.toMap(objectMapper, NAME, card);
                return snapshots.newestUpdate()
                    .map(updatedAt -> CapabilityResult.ok(data, Asof.of(updatedAt)))
                    .orElseGet(() -> CapabilityResult.degraded(data, Asof.now(clock), NO_DATA_NOTE));
            });
    }
}

package com.eventedge.hypepipe.capability.handler;

import com.eventedge.common.classifier.MarketRegimeClassifier;
import com.eventedge.common.model.RegimeView;
import com.eventedge.hypepipe.capability.CapabilityHandler;
import com.eventedge.hypepipe.capability.CapabilityResult;
import com.eventedge.hypepipe.snapshot.MarketSnapshotLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * {@code macro.regime}: BTC market regime (label, confidence, four axes, three drivers).
 */
@Component
public class MacroRegimeCapability implements CapabilityHandler {

    public static final String NAME = "macro.regime";
    static final int DEFAULT_TTL_SECONDS = 60;
    static final String SYMBOL = "BTC";
    static final String NO_DATA_NOTE = "no snapshot data";

    private final MarketSnapshotLoader snapshotLoader;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MacroRegimeCapability(MarketSnapshotLoader snapshotLoader, ObjectMapper objectMapper, Clock clock) {
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
        return snapshotLoader.load(SYMBOL)
            .map(snapshots -> {
                RegimeView view = MarketRegimeClassifier.classify(snapshots);
                Map<String, Object> data = Views.toMap(objectMapper, NAME, view);
                return snapshots.newestUpdate()
                    .map(updatedAt -> CapabilityResult.ok(data, Asof.of(updatedAt)))
                    .orElseGet(() -> CapabilityResult.degraded(data, Asof.now(clock), NO_DATA_NOTE));
            });
    }
}

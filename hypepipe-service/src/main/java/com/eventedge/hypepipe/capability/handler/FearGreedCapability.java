package com.eventedge.hypepipe.capability.handler;

import com.eventedge.common.sentiment.FearGreedParser;
import com.eventedge.common.sentiment.FearGreedView;
import com.eventedge.common.snapshot.SnapshotKeys;
import com.eventedge.hypepipe.capability.CapabilityHandler;
import com.eventedge.hypepipe.capability.CapabilityResult;
import com.eventedge.hypepipe.snapshot.SnapshotReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * {@code sentiment.fear_greed}: current index value plus a week of history.
 */
@Component
public class FearGreedCapability implements CapabilityHandler {

    public static final String NAME = "sentiment.fear_greed";
    static final int DEFAULT_TTL_SECONDS = 300;
    static final String NO_DATA_NOTE = "no snapshot data";

    private final SnapshotReader snapshotReader;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FearGreedCapability(SnapshotReader snapshotReader, ObjectMapper objectMapper, Clock clock) {
        this.snapshotReader = snapshotReader;
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
        return snapshotReader.get(SnapshotKeys.FEAR_GREED)
            .map(snapshot -> {
                Map<String, Object> data = toMap(FearGreedParser.parse(snapshot.payload()));
                return snapshot.updatedAt() != null
                    ? CapabilityResult.ok(data, Asof.of(snapshot.updatedAt()))
                    : CapabilityResult.degraded(data, Asof.now(clock), "snapshot has no timestamp");
            })
            .switchIfEmpty(Mono.fromSupplier(() ->
                CapabilityResult.degraded(toMap(FearGreedParser.neutral()), Asof.now(clock), NO_DATA_NOTE)));
    }

    private Map<String, Object> toMap(FearGreedView view) {
        return Views.toMap(objectMapper, NAME, view);
    }
}

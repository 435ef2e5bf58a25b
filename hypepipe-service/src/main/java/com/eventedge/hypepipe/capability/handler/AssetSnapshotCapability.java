package com.eventedge.hypepipe.capability.handler;

import com.eventedge.common.snapshot.Snapshot;
import com.eventedge.common.snapshot.SnapshotExtractors;
import com.eventedge.common.snapshot.SnapshotKeys;
import com.eventedge.hypepipe.capability.CapabilityHandler;
import com.eventedge.hypepipe.capability.CapabilityResult;
import com.eventedge.hypepipe.snapshot.SnapshotReader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@code core.asset.snapshot}: spot price and 24h change for BTC or ETH, with the
 * funding rate and open interest added when those snapshots exist.
 *
 * <p>Unsupported assets and a missing price snapshot both yield a degraded
 * {@code note=stub} result.
 */
@Component
public class AssetSnapshotCapability implements CapabilityHandler {

    public static final String NAME = "core.asset.snapshot";
    static final int DEFAULT_TTL_SECONDS = 30;
    static final String STUB_NOTE = "stub";

    private final SnapshotReader snapshotReader;
    private final Clock clock;

    public AssetSnapshotCapability(SnapshotReader snapshotReader, Clock clock) {
        this.snapshotReader = snapshotReader;
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
        Object raw = input.get("asset");
        String asset = (raw != null ? String.valueOf(raw) : "BTC").trim().toUpperCase(Locale.ROOT);

        Optional<String> coinGeckoId = SnapshotKeys.coinGeckoId(asset);
        if (coinGeckoId.isEmpty()) {
            return Mono.just(stub(asset));
        }

        return snapshotReader.get(SnapshotKeys.price(coinGeckoId.get()))
            .flatMap(price -> Mono.zip(
                    optional(SnapshotKeys.funding(asset)),
                    optional(SnapshotKeys.openInterest(asset)))
                .map(t -> live(asset, price, t.getT1().orElse(null), t.getT2().orElse(null))))
            .switchIfEmpty(Mono.fromSupplier(() -> stub(asset)));
    }

    private CapabilityResult live(String asset, Snapshot price, Snapshot funding, Snapshot openInterest) {
        SnapshotExtractors.PriceReading reading = SnapshotExtractors.price(price.payload());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("asset", asset);
        data.put("price", reading.price());
        data.put("change_24h", reading.change24h());
        if (funding != null) {
            Double fundingPct = SnapshotExtractors.fundingPercent(funding.payload());
            if (fundingPct != null) {
                data.put("funding_pct", fundingPct);
            }
        }
        if (openInterest != null) {
            Double oiUsd = SnapshotExtractors.openInterest(openInterest.payload()).oiUsd();
            if (oiUsd != null) {
                data.put("oi_usd", oiUsd);
            }
        }

        String asof = Stream.of(price, funding, openInterest)
            .filter(Objects::nonNull)
            .map(Snapshot::updatedAt)
            .filter(Objects::nonNull)
            .max(OffsetDateTime::compareTo)
            .map(Asof::of)
            .orElseGet(() -> Asof.now(clock));
        return CapabilityResult.ok(data, asof);
    }

    private CapabilityResult stub(String asset) {
        return CapabilityResult.degraded(Map.of("asset", asset), Asof.now(clock), STUB_NOTE);
    }

    private Mono<Optional<Snapshot>> optional(String datasetKey) {
        return snapshotReader.get(datasetKey)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }
}

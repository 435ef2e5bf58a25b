package com.eventedge.hypepipe.snapshot;

import com.eventedge.common.model.MarketSnapshots;
import com.eventedge.common.snapshot.Snapshot;
import com.eventedge.common.snapshot.SnapshotKeys;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Fetches every snapshot a market view may need for one symbol, in parallel.
 */
@Component
public class MarketSnapshotLoader {

    private final SnapshotReader snapshotReader;

    public MarketSnapshotLoader(SnapshotReader snapshotReader) {
        this.snapshotReader = snapshotReader;
    }

    public Mono<MarketSnapshots> load(String symbol) {
        Mono<Optional<Snapshot>> price = SnapshotKeys.coinGeckoId(symbol)
            .map(id -> optional(SnapshotKeys.price(id)))
            .orElse(Mono.just(Optional.empty()));

        return Mono.zip(
                price,
                optional(SnapshotKeys.funding(symbol)),
                optional(SnapshotKeys.openInterest(symbol)),
                optional(SnapshotKeys.liquidations(symbol)),
                optional(SnapshotKeys.GLOBAL),
                optional(SnapshotKeys.FEAR_GREED))
            .map(t -> new MarketSnapshots(
                symbol,
                t.getT1().orElse(null),
                t.getT2().orElse(null),
                t.getT3().orElse(null),
                t.getT4().orElse(null),
                t.getT5().orElse(null),
                t.getT6().orElse(null)));
    }

    private Mono<Optional<Snapshot>> optional(String datasetKey) {
        return snapshotReader.get(datasetKey)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }
}

package com.eventedge.common.model;

import com.eventedge.common.snapshot.Snapshot;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The set of snapshots a derived market view reads for one symbol.
 * Any member may be {@code null} when the fetcher has not populated it.
 */
public record MarketSnapshots(
    String symbol,
    Snapshot price,
    Snapshot funding,
    Snapshot openInterest,
    Snapshot liquidations,
    Snapshot global,
    Snapshot fearGreed
) {
    public static MarketSnapshots empty(String symbol) {
        return new MarketSnapshots(symbol, null, null, null, null, null, null);
    }

    /** Newest {@code updated_at} across the snapshots that are present. */
    public Optional<OffsetDateTime> newestUpdate() {
        return present()
            .map(Snapshot::updatedAt)
            .filter(Objects::nonNull)
            .max(OffsetDateTime::compareTo);
    }

    public boolean isEmpty() {
        return present().findAny().isEmpty();
    }

    private Stream<Snapshot> present() {
        return Stream.of(price, funding, openInterest, liquidations, global, fearGreed)
            .filter(Objects::nonNull);
    }
}

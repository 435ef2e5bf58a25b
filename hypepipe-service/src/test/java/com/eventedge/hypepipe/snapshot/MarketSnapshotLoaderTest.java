package com.eventedge.hypepipe.snapshot;

import com.eventedge.common.model.MarketSnapshots;
import com.eventedge.hypepipe.support.MapSnapshotReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MarketSnapshotLoaderTest {

    @Test
    @DisplayName("loads the six dataset keys for a tracked symbol")
    void loadsAllKeys() {
        OffsetDateTime ts = OffsetDateTime.parse("2026-03-01T11:55:00Z");
        MapSnapshotReader reader = new MapSnapshotReader()
            .with("coingecko:price_simple:usd:ethereum", "{}", ts)
            .with("altme:fear_greed", "{}", ts);

        StepVerifier.create(new MarketSnapshotLoader(reader).load("ETH"))
            .assertNext(snapshots -> {
                assertEquals("ETH", snapshots.symbol());
                assertNotNull(snapshots.price());
                assertNotNull(snapshots.fearGreed());
                assertNull(snapshots.funding());
                assertNull(snapshots.global());
                assertEquals(ts, snapshots.newestUpdate().orElseThrow());
            })
            .verifyComplete();

        assertEquals(Set.of(
                "coingecko:price_simple:usd:ethereum",
                "coinglass:oi_weighted_funding:ETH",
                "coinglass:open_interest:ETH",
                "coinglass:liquidations:ETH",
                "coingecko:global",
                "altme:fear_greed"),
            Set.copyOf(reader.requestedKeys()));
    }

    @Test
    @DisplayName("nothing found → an empty set, never an empty Mono")
    void nothingFound() {
        StepVerifier.create(new MarketSnapshotLoader(new MapSnapshotReader()).load("BTC"))
            .assertNext(snapshots -> assertTrue(snapshots.isEmpty()))
            .verifyComplete();
    }

    @Test
    void untrackedSymbolSkipsPrice() {
        MapSnapshotReader reader = new MapSnapshotReader();

        MarketSnapshots snapshots = new MarketSnapshotLoader(reader).load("SOL").block();

        assertNotNull(snapshots);
        assertFalse(reader.requestedKeys().stream().anyMatch(k -> k.startsWith("coingecko:price_simple")));
    }
}

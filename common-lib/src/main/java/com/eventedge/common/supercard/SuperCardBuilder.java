package com.eventedge.common.supercard;

import com.eventedge.common.format.DisplayFormat;
import com.eventedge.common.model.Confidence;
import com.eventedge.common.model.MarketSnapshots;
import com.eventedge.common.snapshot.SnapshotExtractors;
import com.eventedge.common.snapshot.SnapshotExtractors.FearGreedReading;
import com.eventedge.common.snapshot.SnapshotExtractors.GlobalReading;
import com.eventedge.common.snapshot.SnapshotExtractors.LiquidationReading;
import com.eventedge.common.snapshot.SnapshotExtractors.OpenInterestReading;
import com.eventedge.common.snapshot.SnapshotExtractors.PriceReading;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the {@link SuperCard} pillars from live snapshots. Each pillar degrades
 * to an em dash on its own when its source snapshot is missing.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class SuperCardBuilder {

    public static final String VERSION = "v0.2-live";
    public static final String DEFAULT_SYMBOL = "BTC";

    private static final Set<String> SUPPORTED = Set.of("BTC", "ETH");

    private static final String DISCLAIMER =
        "Interpretation signals derived from live snapshots. "
        + "Values are intentionally high-level (no methodology disclosed).";

    private SuperCardBuilder() {}

    /** Upper-cases the symbol; anything other than BTC/ETH falls back to BTC. */
    public static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return DEFAULT_SYMBOL;
        }
        String sym = symbol.trim().toUpperCase(Locale.ROOT);
        return SUPPORTED.contains(sym) ? sym : DEFAULT_SYMBOL;
    }

    public static SuperCard build(MarketSnapshots snapshots) {
        String sym = normalizeSymbol(snapshots.symbol());

        PriceReading price = snapshots.price() != null
            ? SnapshotExtractors.price(snapshots.price().payload()) : new PriceReading(null, null);
        Double fundingPct = snapshots.funding() != null
            ? SnapshotExtractors.fundingPercent(snapshots.funding().payload()) : null;
        OpenInterestReading oi = snapshots.openInterest() != null
            ? SnapshotExtractors.openInterest(snapshots.openInterest().payload()) : OpenInterestReading.EMPTY;
        LiquidationReading liq = snapshots.liquidations() != null
            ? SnapshotExtractors.liquidations(snapshots.liquidations().payload()) : LiquidationReading.EMPTY;
        GlobalReading global = snapshots.global() != null
            ? SnapshotExtractors.global(snapshots.global().payload()) : GlobalReading.EMPTY;
        FearGreedReading fear = snapshots.fearGreed() != null
            ? SnapshotExtractors.fearGreed(snapshots.fearGreed().payload()) : FearGreedReading.EMPTY;

        int partsOk = 0;
        List<SuperCard.Pillar> pillars = new ArrayList<>(6);

        // Flow: liquidation intensity + global volume as market-pressure proxy
        boolean hasFlow = liq.totalUsd() != null || global.totalVolumeUsd() != null;
        pillars.add(new SuperCard.Pillar("flow", "Flow",
            hasFlow
                ? DisplayFormat.usd(liq.totalUsd()) + " liqs / " + DisplayFormat.usd(global.totalVolumeUsd()) + " vol"
                : DisplayFormat.ABSENT,
            status(bucket(liq.totalUsd(), 25_000_000.0, 120_000_000.0)),
            "pressure proxy (liqs/volume)"));
        if (hasFlow) partsOk++;

        boolean hasLeverage = oi.oiUsd() != null || fundingPct != null;
        pillars.add(new SuperCard.Pillar("leverage", "Leverage",
            hasLeverage
                ? DisplayFormat.usd(oi.oiUsd()) + " OI • " + DisplayFormat.pct(fundingPct, 3) + " funding"
                : DisplayFormat.ABSENT,
            status(bucket(fundingPct, -0.02, 0.10)),
            "OI + funding stress"));
        if (hasLeverage) partsOk++;

        boolean hasFragility = liq.longPct() != null && liq.shortPct() != null;
        pillars.add(new SuperCard.Pillar("fragility", "Fragility",
            hasFragility
                ? DisplayFormat.pct(liq.longPct(), 0) + " long / " + DisplayFormat.pct(liq.shortPct(), 0) + " short"
                : DisplayFormat.ABSENT,
            status(bucket(liq.longPct(), 40.0, 70.0)),
            "liq imbalance + spikes"));
        if (hasFragility) partsOk++;

        boolean hasMomentum = price.price() != null || price.change24h() != null;
        pillars.add(new SuperCard.Pillar("momentum", "Momentum",
            hasMomentum
                ? DisplayFormat.usd(price.price()) + " • " + DisplayFormat.pct(price.change24h()) + " 24h"
                : DisplayFormat.ABSENT,
            status(bucket(price.change24h(), -1.0, 1.0)),
            "trend + volatility"));
        if (hasMomentum) partsOk++;

        pillars.add(new SuperCard.Pillar("sentiment", "Sentiment",
            sentimentValue(fear),
            status(sentimentBucket(fear.value())),
            "fear/greed index"));
        if (fear.value() != null) partsOk++;

        boolean hasRisk = oi.oiChange24h() != null || global.btcDominance() != null;
        pillars.add(new SuperCard.Pillar("risk", "Risk",
            hasRisk
                ? "OI " + DisplayFormat.pct(oi.oiChange24h()) + " • BTC dom " + DisplayFormat.pct(global.btcDominance(), 1)
                : DisplayFormat.ABSENT,
            status(bucket(oi.oiChange24h(), -2.0, 2.0)),
            "regime + confidence"));
        if (hasRisk) partsOk++;

        SuperCard.Summary summary = new SuperCard.Summary(
            sym + " SuperCard",
            stance(price.change24h(), fear.value(), fundingPct, liq.longPct()),
            Confidence.fromParts(partsOk, 5, 3),
            notes(fundingPct, liq.totalUsd(), fear.value()));

        return new SuperCard(sym, VERSION, summary, List.copyOf(pillars), DISCLAIMER);
    }

    static String stance(Double change24h, Integer fear, Double fundingPct, Double longPct) {
        if (fear != null && fear <= 25 && change24h != null && change24h < 0) {
            return "cautious";
        }
        if (fundingPct != null && fundingPct >= 0.10 && longPct != null && longPct >= 70.0) {
            return "crowded-longs";
        }
        if (change24h != null && change24h > 1.0) {
            return "risk-on";
        }
        return "neutral";
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private enum Bucket { LOW, NEUTRAL, HIGH }

    private static Bucket bucket(Double x, double lo, double hi) {
        if (x == null) return Bucket.NEUTRAL;
        if (x <= lo) return Bucket.LOW;
        if (x >= hi) return Bucket.HIGH;
        return Bucket.NEUTRAL;
    }

    private static Bucket sentimentBucket(Integer fear) {
        if (fear == null) return Bucket.NEUTRAL;
        if (fear <= 25) return Bucket.LOW;
        if (fear >= 60) return Bucket.HIGH;
        return Bucket.NEUTRAL;
    }

    private static PillarStatus status(Bucket bucket) {
        switch (bucket) {
            case HIGH:
                return PillarStatus.POSITIVE;
            case LOW:
                return PillarStatus.NEGATIVE;
            default:
                return PillarStatus.NEUTRAL;
        }
    }

    private static String sentimentValue(FearGreedReading fear) {
        if (fear.value() == null) {
            return DisplayFormat.ABSENT;
        }
        if (fear.label() != null && !fear.label().isBlank()) {
            return fear.value() + " — " + fear.label();
        }
        return String.valueOf(fear.value());
    }

    private static List<String> notes(Double fundingPct, Double liqTotal, Integer fear) {
        List<String> notes = new ArrayList<>();
        if (fundingPct != null) {
            notes.add("Funding reflects positioning pressure (crowding proxy).");
        }
        if (liqTotal != null) {
            notes.add("Liquidations help gauge fragility and forced flow.");
        }
        if (fear != null) {
            notes.add("Sentiment adds a behavioral context layer.");
        }
        while (notes.size() < 3) {
            notes.add(DisplayFormat.ABSENT);
        }
        return List.copyOf(notes);
    }
}

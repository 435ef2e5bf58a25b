package com.eventedge.common.classifier;

import com.eventedge.common.format.DisplayFormat;
import com.eventedge.common.model.Confidence;
import com.eventedge.common.model.MarketRegime;
import com.eventedge.common.model.MarketSnapshots;
import com.eventedge.common.model.RegimeView;
import com.eventedge.common.snapshot.SnapshotExtractors;
import com.eventedge.common.snapshot.SnapshotExtractors.LiquidationReading;
import com.eventedge.common.snapshot.SnapshotExtractors.OpenInterestReading;
import com.eventedge.common.snapshot.SnapshotExtractors.PriceReading;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure stateless classifier that maps live snapshots to a {@link MarketRegime}.
 *
 * <p>Axes (each a three-way bucket):
 * <ol>
 *   <li>trend     : 24h price change: &ge; 1% up, &le; -1% down, otherwise flat</li>
 *   <li>volatility: liquidation total: &le; $25M calm, &ge; $120M shock, otherwise chop</li>
 *   <li>leverage  : OI-weighted funding: &le; -0.02% light, &ge; 0.10% crowded</li>
 *   <li>liquidity : long share of liquidations: &ge; 70% tight, &le; 40% loose</li>
 * </ol>
 *
 * <p>Regime rules (evaluated in priority order):
 * <ol>
 *   <li>down trend AND (crowded OR tight OR fear &le; 25) → {@link MarketRegime#RISK_OFF}</li>
 *   <li>directional trend AND volatility not chop       → {@link MarketRegime#TREND}</li>
 *   <li>up trend AND not crowded AND fear &gt; 25        → {@link MarketRegime#RISK_ON}</li>
 *   <li>otherwise                                       → {@link MarketRegime#CHOP}</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class MarketRegimeClassifier {

    public static final String VERSION = "v0.2-live";

    static final double TREND_THRESHOLD_PCT   = 1.0;
    static final double LIQ_CALM_USD          = 25_000_000.0;
    static final double LIQ_SHOCK_USD         = 120_000_000.0;
    static final double FUNDING_LIGHT_PCT     = -0.02;
    static final double FUNDING_CROWDED_PCT   = 0.10;
    static final double LONG_SHARE_TIGHT_PCT  = 70.0;
    static final double LONG_SHARE_LOOSE_PCT  = 40.0;
    static final int    EXTREME_FEAR          = 25;

    private static final String DISCLAIMER =
        "Heuristic regime classifier derived from live snapshots. "
        + "Outputs are buckets and drivers (no model disclosure).";

    private MarketRegimeClassifier() {}

    public static RegimeView classify(MarketSnapshots snapshots) {
        PriceReading price = snapshots.price() != null
            ? SnapshotExtractors.price(snapshots.price().payload()) : new PriceReading(null, null);
        Double fundingPct = snapshots.funding() != null
            ? SnapshotExtractors.fundingPercent(snapshots.funding().payload()) : null;
        OpenInterestReading oi = snapshots.openInterest() != null
            ? SnapshotExtractors.openInterest(snapshots.openInterest().payload()) : OpenInterestReading.EMPTY;
        LiquidationReading liq = snapshots.liquidations() != null
            ? SnapshotExtractors.liquidations(snapshots.liquidations().payload()) : LiquidationReading.EMPTY;
        Integer fear = snapshots.fearGreed() != null
            ? SnapshotExtractors.fearGreed(snapshots.fearGreed().payload()).value() : null;

        int partsOk = 0;
        if (price.change24h() != null) partsOk++;
        if (fundingPct != null) partsOk++;
        if (oi.oiChange24h() != null) partsOk++;
        if (liq.totalUsd() != null) partsOk++;

        Trend trend = trend(price.change24h());
        Volatility volatility = volatility(liq.totalUsd());
        Leverage leverage = leverage(fundingPct);
        Liquidity liquidity = liquidity(liq.longPct());

        MarketRegime label = regime(trend, volatility, leverage, liquidity, fear);
        Confidence confidence = Confidence.fromParts(partsOk, 4, 2);

        List<RegimeView.Axis> axes = List.of(
            new RegimeView.Axis("trend", "Trend", price.change24h() == null ? DisplayFormat.ABSENT : trend.label),
            new RegimeView.Axis("volatility", "Volatility", volatility.label),
            new RegimeView.Axis("leverage", "Leverage", leverage.label),
            new RegimeView.Axis("liquidity", "Liquidity", liquidity.label));

        return new RegimeView(
            VERSION,
            new RegimeView.Regime(label, confidence),
            axes,
            drivers(snapshots.symbol(), price, fundingPct, liq, fear),
            DISCLAIMER);
    }

    static MarketRegime regime(Trend trend, Volatility volatility, Leverage leverage,
                               Liquidity liquidity, Integer fear) {
        boolean extremeFear = fear != null && fear <= EXTREME_FEAR;
        if (trend == Trend.DOWN
                && (leverage == Leverage.CROWDED || liquidity == Liquidity.TIGHT || extremeFear)) {
            return MarketRegime.RISK_OFF;
        }
        if (trend != Trend.FLAT && volatility != Volatility.CHOP) {
            return MarketRegime.TREND;
        }
        if (trend == Trend.UP && leverage != Leverage.CROWDED && !extremeFear) {
            return MarketRegime.RISK_ON;
        }
        return MarketRegime.CHOP;
    }

    // ── buckets ────────────────────────────────────────────────────────────

    static Trend trend(Double change24h) {
        if (change24h == null) return Trend.FLAT;
        if (change24h >= TREND_THRESHOLD_PCT) return Trend.UP;
        if (change24h <= -TREND_THRESHOLD_PCT) return Trend.DOWN;
        return Trend.FLAT;
    }

    static Volatility volatility(Double liquidationTotal) {
        if (liquidationTotal == null) return Volatility.CHOP;
        if (liquidationTotal <= LIQ_CALM_USD) return Volatility.CALM;
        if (liquidationTotal >= LIQ_SHOCK_USD) return Volatility.SHOCK;
        return Volatility.CHOP;
    }

    static Leverage leverage(Double fundingPct) {
        if (fundingPct == null) return Leverage.NORMAL;
        if (fundingPct <= FUNDING_LIGHT_PCT) return Leverage.LIGHT;
        if (fundingPct >= FUNDING_CROWDED_PCT) return Leverage.CROWDED;
        return Leverage.NORMAL;
    }

    static Liquidity liquidity(Double longPct) {
        if (longPct == null) return Liquidity.NORMAL;
        if (longPct >= LONG_SHARE_TIGHT_PCT) return Liquidity.TIGHT;
        if (longPct <= LONG_SHARE_LOOSE_PCT) return Liquidity.LOOSE;
        return Liquidity.NORMAL;
    }

    private static List<String> drivers(String symbol, PriceReading price, Double fundingPct,
                                        LiquidationReading liq, Integer fear) {
        List<String> drivers = new ArrayList<>();
        if (price.change24h() != null && price.price() != null) {
            drivers.add(symbol + " " + DisplayFormat.usd(price.price()) + " • "
                + DisplayFormat.pct(price.change24h()) + " 24h (trend axis)");
        }
        if (fundingPct != null) {
            drivers.add("Funding " + DisplayFormat.pct(fundingPct, 3) + " (crowding proxy)");
        }
        if (liq.totalUsd() != null && liq.longPct() != null) {
            drivers.add("Liqs " + DisplayFormat.usd(liq.totalUsd()) + " • "
                + DisplayFormat.pct(liq.longPct(), 0, false) + " long (fragility proxy)");
        }
        if (fear != null) {
            drivers.add("Fear & Greed " + fear + " (sentiment context)");
        }
        while (drivers.size() < 3) {
            drivers.add(DisplayFormat.ABSENT);
        }
        return List.copyOf(drivers.subList(0, 3));
    }

    enum Trend {
        UP("Up"), DOWN("Down"), FLAT("Flat");

        final String label;

        Trend(String label) {
            this.label = label;
        }
    }

    enum Volatility {
        CALM("Calm"), CHOP("Chop"), SHOCK("Shock");

        final String label;

        Volatility(String label) {
            this.label = label;
        }
    }

    enum Leverage {
        LIGHT("Light"), NORMAL("Normal"), CROWDED("Crowded");

        final String label;

        Leverage(String label) {
            this.label = label;
        }
    }

    enum Liquidity {
        LOOSE("Loose"), NORMAL("Normal"), TIGHT("Tight");

        final String label;

        Liquidity(String label) {
            this.label = label;
        }
    }
}

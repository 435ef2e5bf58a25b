package com.eventedge.common.snapshot;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pulls typed readings out of raw provider payloads.
 *
 * <p>Every extractor tolerates missing or malformed fields: an absent value is
 * returned as {@code null} rather than throwing, so callers can degrade a single
 * field without failing the whole view.
 */
public final class SnapshotExtractors {

    private SnapshotExtractors() {}

    /** {@code coingecko:price_simple:usd:{id}}: {@code {"data": {"price", "change_24h"}}}. */
    public static PriceReading price(JsonNode payload) {
        JsonNode data = payload.path("data");
        return new PriceReading(num(data.path("price")), num(data.path("change_24h")));
    }

    /** {@code coingecko:global}. */
    public static GlobalReading global(JsonNode payload) {
        JsonNode data = payload.path("data");
        return new GlobalReading(
            num(data.path("btc_dominance")),
            num(data.path("eth_dominance")),
            num(data.path("total_market_cap_usd")),
            num(data.path("total_volume_usd")),
            num(data.path("market_cap_change_24h_pct")));
    }

    /**
     * {@code coinglass:oi_weighted_funding:{SYM}}. The provider reports a fraction
     * (0.001178); the reading is converted to percent (0.1178).
     */
    public static Double fundingPercent(JsonNode payload) {
        Double rate = num(payload.path("data").path("rate"));
        return rate != null ? rate * 100.0 : null;
    }

    /** {@code coinglass:open_interest:{SYM}}. */
    public static OpenInterestReading openInterest(JsonNode payload) {
        JsonNode data = payload.path("data");
        return new OpenInterestReading(num(data.path("oi_usd")), num(data.path("oi_change_24h")));
    }

    /**
     * {@code coinglass:liquidations:{SYM}}: per-exchange rows under {@code raw};
     * the {@code exchange = "All"} row carries totals, otherwise the first row is used.
     */
    public static LiquidationReading liquidations(JsonNode payload) {
        JsonNode raw = payload.path("raw");
        if (!raw.isArray() || raw.isEmpty()) {
            return LiquidationReading.EMPTY;
        }
        JsonNode row = null;
        for (JsonNode candidate : raw) {
            if (candidate.isObject() && "All".equals(candidate.path("exchange").asText(null))) {
                row = candidate;
                break;
            }
        }
        if (row == null) {
            row = raw.get(0);
        }

        Double total = num(row.path("liquidation_usd"));
        Double longUsd = num(row.path("longLiquidation_usd"));
        Double shortUsd = num(row.path("shortLiquidation_usd"));
        boolean hasTotal = total != null && total != 0.0;
        Double longPct = hasTotal && longUsd != null ? longUsd / total * 100.0 : null;
        Double shortPct = hasTotal && shortUsd != null ? shortUsd / total * 100.0 : null;
        return new LiquidationReading(total, longUsd, shortUsd, longPct, shortPct);
    }

    /** {@code altme:fear_greed}: the newest row is {@code data[0]}. */
    public static FearGreedReading fearGreed(JsonNode payload) {
        JsonNode first = payload.path("data").path(0);
        if (!first.isObject()) {
            return FearGreedReading.EMPTY;
        }
        Double value = num(first.path("value"));
        String label = first.path("value_classification").asText(null);
        return new FearGreedReading(value != null ? value.intValue() : null, label);
    }

    /** Lenient numeric read: numbers and numeric strings parse, anything else is {@code null}. */
    static Double num(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public record PriceReading(Double price, Double change24h) {}

    public record GlobalReading(
        Double btcDominance,
        Double ethDominance,
        Double totalMarketCapUsd,
        Double totalVolumeUsd,
        Double marketCapChange24h
    ) {
        public static final GlobalReading EMPTY = new GlobalReading(null, null, null, null, null);
    }

    public record OpenInterestReading(Double oiUsd, Double oiChange24h) {
        public static final OpenInterestReading EMPTY = new OpenInterestReading(null, null);
    }

    public record LiquidationReading(
        Double totalUsd,
        Double longUsd,
        Double shortUsd,
        Double longPct,
        Double shortPct
    ) {
        public static final LiquidationReading EMPTY = new LiquidationReading(null, null, null, null, null);
    }

    public record FearGreedReading(Integer value, String label) {
        public static final FearGreedReading EMPTY = new FearGreedReading(null, null);
    }
}

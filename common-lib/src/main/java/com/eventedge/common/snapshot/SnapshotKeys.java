package com.eventedge.common.snapshot;

import java.util.Map;
import java.util.Optional;

/**
 * Dataset keys written by the snapshot fetchers.
 */
public final class SnapshotKeys {

    public static final String GLOBAL     = "coingecko:global";
    public static final String FEAR_GREED = "altme:fear_greed";

    private static final Map<String, String> COINGECKO_IDS = Map.of(
        "BTC", "bitcoin",
        "ETH", "ethereum"
    );

    private SnapshotKeys() {}

    /** CoinGecko coin id for a tracked asset symbol, empty when the asset is not tracked. */
    public static Optional<String> coinGeckoId(String symbol) {
        return Optional.ofNullable(symbol).map(COINGECKO_IDS::get);
    }

    public static String price(String coinGeckoId) {
        return "coingecko:price_simple:usd:" + coinGeckoId;
    }

    public static String funding(String symbol) {
        return "coinglass:oi_weighted_funding:" + symbol;
    }

    public static String openInterest(String symbol) {
        return "coinglass:open_interest:" + symbol;
    }

    public static String liquidations(String symbol) {
        return "coinglass:liquidations:" + symbol;
    }
}

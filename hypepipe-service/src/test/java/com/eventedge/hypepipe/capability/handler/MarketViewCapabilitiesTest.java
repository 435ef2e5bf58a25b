package com.eventedge.hypepipe.capability.handler;

import com.eventedge.hypepipe.capability.CapabilityResult;
import com.eventedge.hypepipe.config.HypePipeConfig;
import com.eventedge.hypepipe.snapshot.MarketSnapshotLoader;
import com.eventedge.hypepipe.support.MapSnapshotReader;
import com.eventedge.hypepipe.support.TestTokens;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@code macro.regime}, {@code macro.pillars} and {@code sentiment.fear_greed} over an
 * in-memory dataset registry.
 */
class MarketViewCapabilitiesTest {

    private static final ObjectMapper MAPPER = new HypePipeConfig().objectMapper();
    private static final OffsetDateTime OLDER = OffsetDateTime.parse("2026-03-01T11:50:00Z");
    private static final OffsetDateTime NEWER = OffsetDateTime.parse("2026-03-01T11:55:00Z");

    private static MapSnapshotReader btcMarket() {
        return new MapSnapshotReader()
            .with("coingecko:price_simple:usd:bitcoin", "{\"data\":{\"price\":61000,\"change_24h\":-3.2}}", OLDER)
            .with("coinglass:oi_weighted_funding:BTC", "{\"data\":{\"rate\":0.0012}}", OLDER)
            .with("coinglass:liquidations:BTC",
                "{\"raw\":[{\"exchange\":\"All\",\"liquidation_usd\":150000000,"
                + "\"longLiquidation_usd\":120000000,\"shortLiquidation_usd\":30000000}]}", NEWER)
            .with("altme:fear_greed", "{\"data\":[{\"value\":\"18\",\"value_classification\":\"Extreme Fear\"}]}", OLDER);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> child(Map<String, Object> data, String key) {
        return (Map<String, Object>) data.get(key);
    }

    @Nested
    @DisplayName("macro.regime")
    class Regime {

        @Test
        @DisplayName("falling market with crowded funding → Risk-Off, asof of newest snapshot")
        void riskOff() {
            MacroRegimeCapability capability = new MacroRegimeCapability(
                new MarketSnapshotLoader(btcMarket()), MAPPER, TestTokens.CLOCK);

            StepVerifier.create(capability.handle(Map.of()))
                .assertNext(result -> {
                    assertEquals(CapabilityResult.Status.OK, result.status());
                    assertEquals("Risk-Off", child(result.data(), "regime").get("label"));
                    assertEquals("medium", child(result.data(), "regime").get("confidence"));
                    assertEquals(4, ((List<?>) result.data().get("axes")).size());
                    assertEquals(3, ((List<?>) result.data().get("drivers")).size());
                    assertEquals("2026-03-01T11:55:00Z", result.asof());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("empty registry → degraded Chop stamped now")
        void noData() {
            MacroRegimeCapability capability = new MacroRegimeCapability(
                new MarketSnapshotLoader(new MapSnapshotReader()), MAPPER, TestTokens.CLOCK);

            StepVerifier.create(capability.handle(Map.of()))
                .assertNext(result -> {
                    assertEquals(CapabilityResult.Status.DEGRADED, result.status());
                    assertEquals("Chop", child(result.data(), "regime").get("label"));
                    assertEquals("2026-03-01T12:00:00Z", result.asof());
                    assertNotNull(result.data().get("note"));
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("macro.pillars")
    class Pillars {

        @Test
        void cautiousBtcCard() {
            MacroPillarsCapability capability = new MacroPillarsCapability(
                new MarketSnapshotLoader(btcMarket()), MAPPER, TestTokens.CLOCK);

            StepVerifier.create(capability.handle(Map.of("symbol", "btc")))
                .assertNext(result -> {
                    assertEquals("BTC", result.data().get("symbol"));
                    assertEquals("cautious", child(result.data(), "summary").get("stance"));
                    assertEquals(6, ((List<?>) result.data().get("pillars")).size());
                    assertEquals("2026-03-01T11:55:00Z", result.asof());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("unsupported symbol falls back to BTC snapshots")
        void unsupportedSymbol() {
            MapSnapshotReader reader = new MapSnapshotReader();
            MacroPillarsCapability capability = new MacroPillarsCapability(
                new MarketSnapshotLoader(reader), MAPPER, TestTokens.CLOCK);

            StepVerifier.create(capability.handle(Map.of("symbol", "DOGE")))
                .assertNext(result -> {
                    assertEquals("BTC", result.data().get("symbol"));
                    assertEquals(CapabilityResult.Status.DEGRADED, result.status());
                })
                .verifyComplete();
            assertTrue(reader.requestedKeys().contains("coinglass:liquidations:BTC"));
        }
    }

    @Nested
    @DisplayName("sentiment.fear_greed")
    class FearGreed {

        @Test
        void currentReading() {
            FearGreedCapability capability = new FearGreedCapability(btcMarket(), MAPPER, TestTokens.CLOCK);

            StepVerifier.create(capability.handle(Map.of()))
                .assertNext(result -> {
                    assertEquals(CapabilityResult.Status.OK, result.status());
                    assertEquals(18, child(result.data(), "current").get("value"));
                    assertEquals("Extreme Fear", child(result.data(), "current").get("label"));
                    assertEquals("2026-03-01T11:50:00Z", result.asof());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("missing snapshot → neutral 50, degraded")
        void missing() {
            FearGreedCapability capability = new FearGreedCapability(new MapSnapshotReader(), MAPPER, TestTokens.CLOCK);

            StepVerifier.create(capability.handle(Map.of()))
                .assertNext(result -> {
                    assertEquals(CapabilityResult.Status.DEGRADED, result.status());
                    assertEquals(50, child(result.data(), "current").get("value"));
                })
                .verifyComplete();
        }
    }
}

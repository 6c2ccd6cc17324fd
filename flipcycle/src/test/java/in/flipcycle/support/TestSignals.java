package in.flipcycle.support;

import in.flipcycle.domain.signal.Signal;

import java.time.Instant;

/**
 * Signal fixtures shared by the tests.
 */
public final class TestSignals {

    public static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    /**
     * BTC long: band 100..102, target 115, stop 97, confidence 0.65 (3 tiers).
     */
    public static Signal.Builder btc() {
        return Signal.builder()
            .signalId("SIG-BTC")
            .asset("BTC/USDT")
            .entryBand(100, 102)
            .targetPrice(115)
            .stopPrice(97)
            .capital(500)
            .confidence(0.65)
            .patternClass("MOMENTUM")
            .emotionalContext(0.5)
            .volatilityContext(0.03)
            .source("test")
            .receivedAt(T0);
    }

    public static Signal.Builder forAsset(String asset, double price) {
        return btc()
            .signalId("SIG-" + asset)
            .asset(asset)
            .entryBand(price, price * 1.02)
            .targetPrice(price * 1.15)
            .stopPrice(price * 0.97);
    }

    private TestSignals() {
    }
}

package in.flipcycle.application.port.output;

import in.flipcycle.domain.order.PriceQuote;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Price-feed collaborator.
 *
 * Failures are transient: a future completing exceptionally (typically with
 * PriceFeedException) means "no price this tick", never "use the last one".
 */
public interface PriceFeed {

    /**
     * Current price and 24h change for one asset.
     */
    CompletableFuture<PriceQuote> getPrice(String asset);

    /**
     * Current prices for several assets. Assets without a quote are absent
     * from the map.
     */
    CompletableFuture<Map<String, BigDecimal>> getPrices(List<String> assets);
}

package in.flipcycle.application.port.output;

/**
 * Thrown (or used to complete a future) when the price feed cannot deliver a
 * quote.
 */
public class PriceFeedException extends RuntimeException {

    private final String asset;

    public PriceFeedException(String asset, String message) {
        super(String.format("Price unavailable for %s: %s", asset, message));
        this.asset = asset;
    }

    public PriceFeedException(String asset, String message, Throwable cause) {
        super(String.format("Price unavailable for %s: %s", asset, message), cause);
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}

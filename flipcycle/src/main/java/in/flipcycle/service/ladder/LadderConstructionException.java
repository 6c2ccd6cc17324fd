package in.flipcycle.service.ladder;

/**
 * Thrown when a ladder cannot be built from the given inputs.
 */
public class LadderConstructionException extends RuntimeException {

    private final String asset;

    public LadderConstructionException(String asset, String message) {
        super(String.format("Cannot build ladder for %s: %s", asset, message));
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}

package in.flipcycle.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration of the flip engine. Missing sections fall back to their
 * defaults.
 */
public record FlipConfig(
    @JsonProperty("scoring")
    ScoringConfig scoring,

    @JsonProperty("ladder")
    LadderConfig ladder,

    @JsonProperty("exit")
    ExitConfig exit,

    @JsonProperty("vault")
    VaultConfig vault,

    @JsonProperty("lifecycle")
    LifecycleConfig lifecycle
) {
    public FlipConfig {
        scoring = scoring != null ? scoring : ScoringConfig.defaults();
        ladder = ladder != null ? ladder : LadderConfig.defaults();
        exit = exit != null ? exit : ExitConfig.defaults();
        vault = vault != null ? vault : VaultConfig.defaults();
        lifecycle = lifecycle != null ? lifecycle : LifecycleConfig.defaults();
    }

    public static FlipConfig defaults() {
        return new FlipConfig(null, null, null, null, null);
    }

    public FlipConfig withLifecycle(LifecycleConfig lifecycle) {
        return new FlipConfig(scoring, ladder, exit, vault, lifecycle);
    }

    public FlipConfig withScoring(ScoringConfig scoring) {
        return new FlipConfig(scoring, ladder, exit, vault, lifecycle);
    }

    @JsonIgnore
    public boolean isValid() {
        return scoring.isValid()
            && ladder.isValid()
            && exit.isValid()
            && vault.isValid()
            && lifecycle.isValid();
    }
}

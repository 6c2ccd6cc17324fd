package in.flipcycle.application.port.output;

/**
 * Pluggable external risk signal (whale activity, stealth detection, ...).
 *
 * Implementations return a bounded score in [0, 1]; 1 is maximum risk. The
 * lifecycle only compares the value against a threshold.
 */
public interface RiskSignal {

    double assess(String asset);

    static RiskSignal none() {
        return asset -> 0.0;
    }
}

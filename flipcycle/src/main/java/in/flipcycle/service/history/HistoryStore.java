package in.flipcycle.service.history;

import in.flipcycle.domain.history.MemoryEcho;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Append-only record of completed cycles.
 */
public interface HistoryStore {

    void append(MemoryEcho echo);

    /**
     * Echoes matching the asset OR the pattern class, completed within
     * lookback of now.
     */
    List<MemoryEcho> query(String asset, String patternClass, Duration lookback, Instant now);

    List<MemoryEcho> all();
}

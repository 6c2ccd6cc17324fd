package in.flipcycle.infrastructure.common;

import java.time.Duration;

/**
 * Backoff sleep, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}

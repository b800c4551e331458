package in.niftybreak.infrastructure.common;

import java.time.Duration;

/**
 * Blocking wait used between retries. Replaced by a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

package space.ketterling.marinedata.fetch;

import java.time.Duration;

/**
 * Blocking pause between retry attempts; swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

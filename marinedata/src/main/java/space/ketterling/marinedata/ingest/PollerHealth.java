package space.ketterling.marinedata.ingest;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Liveness timestamp of one poller: written by the poller after each completed
 * tick, read by the watchdog.
 */
public final class PollerHealth {
    private final AtomicReference<Instant> lastAlive;

    public PollerHealth(Instant createdAt) {
        this.lastAlive = new AtomicReference<>(createdAt);
    }

    public void markAlive(Instant at) {
        lastAlive.set(at);
    }

    public Instant lastAlive() {
        return lastAlive.get();
    }

    /**
     * True when no tick has completed for longer than {@code threshold}.
     */
    public boolean isStale(Instant now, Duration threshold) {
        return Duration.between(lastAlive.get(), now).compareTo(threshold) > 0;
    }
}

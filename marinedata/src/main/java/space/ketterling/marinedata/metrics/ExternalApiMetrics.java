package space.ketterling.marinedata.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider call outcomes over a rolling 60-minute window.
 *
 * <p>
 * Fetchers record every attempt; the watchdog logs {@link #summary()} once per
 * cycle.
 * </p>
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, MinuteBuckets> PROVIDERS = new ConcurrentHashMap<>();

    private ExternalApiMetrics() {
    }

    /**
     * Records one attempt outcome for a provider.
     */
    public static void record(String provider, boolean success) {
        if (provider == null || provider.isBlank())
            return;
        PROVIDERS.computeIfAbsent(provider, k -> new MinuteBuckets()).record(success, nowMinute());
    }

    /**
     * Returns call counts and health status by provider, sorted by name.
     */
    public static Map<String, ProviderSnapshot> snapshot() {
        long now = nowMinute();
        Map<String, ProviderSnapshot> out = new TreeMap<>();
        PROVIDERS.forEach((name, buckets) -> out.put(name, buckets.snapshot(now)));
        return out;
    }

    /**
     * One-line rendering of {@link #snapshot()} for log output.
     */
    public static String summary() {
        StringBuilder sb = new StringBuilder();
        snapshot().forEach((name, s) -> {
            if (sb.length() > 0)
                sb.append(", ");
            sb.append(name).append('=').append(s.status())
                    .append(" (").append(s.failures()).append('/').append(s.calls()).append(" failed)");
        });
        return sb.length() == 0 ? "no calls" : sb.toString();
    }

    /**
     * Clears all recorded outcomes.
     */
    public static void reset() {
        PROVIDERS.clear();
    }

    private static long nowMinute() {
        return System.currentTimeMillis() / 60000L;
    }

    /**
     * Window totals for one provider.
     */
    public record ProviderSnapshot(long calls, long failures, String status) {
        static ProviderSnapshot of(long calls, long failures) {
            String status;
            if (calls == 0) {
                status = "no-data";
            } else {
                double pct = failures * 100.0 / calls;
                status = pct >= 50.0 ? "down" : pct >= 10.0 ? "degraded" : "ok";
            }
            return new ProviderSnapshot(calls, failures, status);
        }
    }

    /**
     * Ring of per-minute counters; a slot is reused once its minute leaves the
     * window.
     */
    private static final class MinuteBuckets {
        private final long[] minute = new long[WINDOW_MINUTES];
        private final long[] calls = new long[WINDOW_MINUTES];
        private final long[] failures = new long[WINDOW_MINUTES];

        synchronized void record(boolean success, long nowMin) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                calls[idx] = 0L;
                failures[idx] = 0L;
            }
            calls[idx]++;
            if (!success)
                failures[idx]++;
        }

        synchronized ProviderSnapshot snapshot(long nowMin) {
            long c = 0L;
            long f = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || nowMin - minute[i] >= WINDOW_MINUTES)
                    continue;
                c += calls[i];
                f += failures[i];
            }
            return ProviderSnapshot.of(c, f);
        }
    }
}

/*
* Copyright 2025 Taylor Ketterling
* Retrying HTTP fetch shared by the CO-OPS and NDBC clients.
* Bounded attempts, exponential backoff and optional request spacing.
*/
package space.ketterling.marinedata.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.metrics.ExternalApiMetrics;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Performs one logical fetch against a provider with bounded retries.
 *
 * <p>
 * Transport failures, 429/5xx responses and malformed bodies are retried with
 * exponential backoff ({@code base, 2*base, 4*base...}). Any other non-2xx
 * status fails immediately. One instance belongs to one poller, so the request
 * spacing state is not shared between threads.
 * </p>
 */
public final class HttpFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

    private final Provider provider;
    private final Transport transport;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration minSpacing;
    private final Sleeper sleeper;

    private long lastRequestNanos;
    private boolean requested;

    public HttpFetcher(Provider provider, Transport transport, Duration timeout, int maxAttempts,
            Duration baseBackoff, Duration minSpacing, Sleeper sleeper) {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.provider = provider;
        this.transport = transport;
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
        this.baseBackoff = baseBackoff;
        this.minSpacing = minSpacing;
        this.sleeper = sleeper;
    }

    /**
     * Builds a fetcher on the given transport using the configured timeout and
     * retry budget.
     */
    public static HttpFetcher create(AppConfig cfg, Provider provider, Transport transport) {
        Duration spacing = provider == Provider.COOPS ? cfg.coopsMinRequestInterval() : Duration.ZERO;
        return new HttpFetcher(provider, transport, cfg.httpTimeout(), cfg.retryAttempts(), cfg.retryBackoff(),
                spacing, Sleeper.SYSTEM);
    }

    /**
     * Fetcher factory that opens one JDK transport per provider on first use
     * and hands it to every fetcher built for that provider afterwards. Each
     * call still returns a new fetcher.
     */
    public static Function<Provider, HttpFetcher> sharedTransports(AppConfig cfg) {
        Map<Provider, Transport> transports = new EnumMap<>(Provider.class);
        return provider -> {
            Transport transport;
            synchronized (transports) {
                transport = transports.computeIfAbsent(provider,
                        k -> new JdkHttpTransport(cfg.httpTimeout(), cfg.userAgent()));
            }
            return create(cfg, provider, transport);
        };
    }

    public Provider provider() {
        return provider;
    }

    Transport transport() {
        return transport;
    }

    /**
     * Fetches {@code url} and parses it, retrying until the attempt budget is
     * spent.
     */
    public <T> T fetch(String url, ResponseParser<T> parser) throws FetchException, InterruptedException {
        log.debug("{} request -> {}", provider.displayName(), url);
        URI uri = URI.create(url);
        long backoffMs = baseBackoff.toMillis();
        Exception lastError = null;
        Integer lastStatus = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            awaitSpacing();
            long delayMs = backoffMs;
            try {
                Transport.RawResponse resp = transport.get(uri, timeout);
                int code = resp.status();
                lastStatus = code;
                if (code >= 200 && code < 300) {
                    T parsed = parser.parse(resp.body());
                    ExternalApiMetrics.record(provider.displayName(), true);
                    log.debug("{} response {} for {}", provider.displayName(), code, url);
                    return parsed;
                }

                ExternalApiMetrics.record(provider.displayName(), false);
                if (code != 429 && (code < 500 || code > 599)) {
                    throw new FetchException(provider, url, attempt, code, "HTTP " + code, null);
                }
                if (resp.retryAfterSeconds() != null) {
                    delayMs = Math.max(delayMs, resp.retryAfterSeconds() * 1000L);
                }
                lastError = new IOException("HTTP " + code);
                log.warn("{} transient failure code={} url={} attempt={}/{}", provider.displayName(), code, url,
                        attempt, maxAttempts);
            } catch (MalformedResponseException e) {
                ExternalApiMetrics.record(provider.displayName(), false);
                lastError = e;
                log.warn("{} malformed response url={} attempt={}/{} err={}", provider.displayName(), url, attempt,
                        maxAttempts, e.getMessage());
            } catch (IOException e) {
                ExternalApiMetrics.record(provider.displayName(), false);
                lastError = e;
                lastStatus = null;
                log.warn("{} request exception url={} attempt={}/{} err={}", provider.displayName(), url, attempt,
                        maxAttempts, e.toString());
            }

            if (attempt < maxAttempts) {
                sleeper.sleep(Duration.ofMillis(delayMs));
                backoffMs *= 2;
            }
        }

        String reason = lastError == null ? "unknown" : lastError.getMessage();
        throw new FetchException(provider, url, maxAttempts, lastStatus, reason, lastError);
    }

    /**
     * Enforces the minimum gap between consecutive requests.
     */
    private void awaitSpacing() throws InterruptedException {
        if (!minSpacing.isZero() && requested) {
            long elapsed = System.nanoTime() - lastRequestNanos;
            long waitNanos = minSpacing.toNanos() - elapsed;
            if (waitNanos > 0) {
                log.debug("{} rate limiting: sleeping {} ms", provider.displayName(), waitNanos / 1_000_000L);
                sleeper.sleep(Duration.ofNanos(waitNanos));
            }
        }
        lastRequestNanos = System.nanoTime();
        requested = true;
    }
}

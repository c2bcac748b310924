package space.ketterling.marinedata.fetch;

import space.ketterling.marinedata.config.Provider;

/**
 * A fetch that gave up, either after the retry budget or on a non-retryable
 * HTTP status.
 */
public class FetchException extends Exception {
    private final Provider provider;
    private final String url;
    private final int attempts;
    private final Integer statusCode;

    public FetchException(Provider provider, String url, int attempts, Integer statusCode, String message,
            Throwable cause) {
        super(provider.displayName() + " fetch failed after " + attempts + " attempt(s): " + message, cause);
        this.provider = provider;
        this.url = url;
        this.attempts = attempts;
        this.statusCode = statusCode;
    }

    public Provider provider() {
        return provider;
    }

    public String url() {
        return url;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Last HTTP status seen, or null when no response arrived.
     */
    public Integer statusCode() {
        return statusCode;
    }

    public boolean notFound() {
        return statusCode != null && statusCode == 404;
    }
}

package space.ketterling.marinedata.fetch;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Issues exactly one GET request. Retries live in {@link HttpFetcher}.
 */
@FunctionalInterface
public interface Transport {

    RawResponse get(URI uri, Duration timeout) throws IOException, InterruptedException;

    /**
     * Status and body of one response.
     *
     * @param retryAfterSeconds value of a numeric Retry-After header, or null
     */
    record RawResponse(int status, String body, Long retryAfterSeconds) {
        public RawResponse(int status, String body) {
            this(status, body, null);
        }
    }
}

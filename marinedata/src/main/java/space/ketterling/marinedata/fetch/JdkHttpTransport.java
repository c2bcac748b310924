package space.ketterling.marinedata.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} backed by the JDK {@link HttpClient}.
 */
public final class JdkHttpTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient http;
    private final String userAgent;

    public JdkHttpTransport(Duration connectTimeout, String userAgent) {
        this.userAgent = userAgent;
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public RawResponse get(URI uri, Duration timeout) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "*/*")
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        Long retryAfter = null;
        String ra = resp.headers().firstValue("Retry-After").orElse(null);
        if (ra != null) {
            try {
                retryAfter = Long.parseLong(ra.trim());
            } catch (NumberFormatException nfe) {
                // HTTP-date form, fall back to exponential backoff
                log.debug("Ignoring non-numeric Retry-After '{}' from {}", ra, uri);
            }
        }
        return new RawResponse(resp.statusCode(), resp.body(), retryAfter);
    }
}

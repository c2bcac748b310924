package space.ketterling.marinedata.fetch;

/**
 * Turns a 2xx response body into a normalized payload.
 */
@FunctionalInterface
public interface ResponseParser<T> {
    T parse(String body) throws MalformedResponseException;
}

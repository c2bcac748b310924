package space.ketterling.marinedata.fetch;

/**
 * A well-delivered response whose body is unusable: unparsable, truncated, or
 * a provider-reported error payload. Retried like a transport failure.
 */
public class MalformedResponseException extends Exception {
    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}

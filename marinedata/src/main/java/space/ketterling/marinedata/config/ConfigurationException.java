package space.ketterling.marinedata.config;

/**
 * Raised when required configuration is missing or malformed. Fatal to startup.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package tech.bulkstream.sdk.exception;

/**
 * Exception thrown when a required construction parameter is missing.
 */
public class ConfigurationException extends BulkApiException {

    public ConfigurationException(String message) {
        super(message);
    }

    public static ConfigurationException missing(String key) {
        return new ConfigurationException(key + " is required");
    }
}

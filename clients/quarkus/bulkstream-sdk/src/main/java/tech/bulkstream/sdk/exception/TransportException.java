package tech.bulkstream.sdk.exception;

/**
 * Exception thrown when a request fails at the network layer.
 */
public class TransportException extends BulkApiException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TransportException requestFailed(String method, String url, Throwable cause) {
        return new TransportException(method + " " + url + " failed: " + cause.getMessage(), cause);
    }

    public static TransportException interrupted(String method, String url, InterruptedException cause) {
        return new TransportException(method + " " + url + " interrupted", cause);
    }
}

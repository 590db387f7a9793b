package tech.bulkstream.sdk.exception;

import java.util.Map;

/**
 * Base exception for bulk API client errors.
 */
public class BulkApiException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public BulkApiException(String message) {
        this(message, 0, null, Map.of());
    }

    public BulkApiException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public BulkApiException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public BulkApiException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Remote exception code (e.g. {@code InvalidBatch}) when the service returned an error payload.
     */
    public String getExceptionCode() {
        Object code = context.get("exceptionCode");
        return code != null ? code.toString() : null;
    }

    public static BulkApiException remoteError(int statusCode, String exceptionCode, String exceptionMessage) {
        String message = exceptionMessage != null && !exceptionMessage.isBlank()
            ? exceptionMessage
            : "Remote error: " + statusCode;
        Map<String, Object> context = exceptionCode != null
            ? Map.of("exceptionCode", exceptionCode)
            : Map.of();
        return new BulkApiException(message, statusCode, null, context);
    }
}

package tech.bulkstream.sdk.exception;

/**
 * Exception thrown when the login exchange is rejected or the session is no longer accepted.
 */
public class AuthenticationException extends BulkApiException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause, null);
    }

    public static AuthenticationException loginRejected(String faultString) {
        return new AuthenticationException(
            faultString != null && !faultString.isBlank() ? faultString : "Login rejected"
        );
    }

    public static AuthenticationException malformedResponse(Throwable cause) {
        return new AuthenticationException("Malformed login response", cause);
    }

    public static AuthenticationException sessionInvalid() {
        return new AuthenticationException("Session token expired or invalid");
    }
}

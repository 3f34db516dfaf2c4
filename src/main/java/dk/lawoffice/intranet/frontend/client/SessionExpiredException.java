package dk.lawoffice.intranet.frontend.client;

/**
 * The stored tokens can no longer be refreshed. The local tokens have been cleared and the
 * user has to log in again.
 */
public class SessionExpiredException extends RuntimeException {

    public SessionExpiredException(String message) {
        super(message);
    }

    public SessionExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}

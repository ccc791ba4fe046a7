package dev.interviewresearch.error;

/**
 * Timeout, connection failure, rate limit or 5xx from an external service.
 */
public class TransientNetworkException extends ResearchException {

    private final int statusCode;

    public TransientNetworkException(String message, int statusCode) {
        super("TRANSIENT_NETWORK", message);
        this.statusCode = statusCode;
    }

    public TransientNetworkException(String message, Throwable cause) {
        super("TRANSIENT_NETWORK", message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

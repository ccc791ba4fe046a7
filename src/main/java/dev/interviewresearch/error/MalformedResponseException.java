package dev.interviewresearch.error;

/**
 * An external service answered, but the body could not be read as the expected structure.
 */
public class MalformedResponseException extends ResearchException {

    public MalformedResponseException(String message) {
        super("MALFORMED_RESPONSE", message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super("MALFORMED_RESPONSE", message, cause);
    }
}

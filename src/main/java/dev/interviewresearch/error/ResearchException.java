package dev.interviewresearch.error;

/**
 * Base class of every failure raised by the research pipeline.
 */
public class ResearchException extends RuntimeException {

    private final String errorCode;

    public ResearchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ResearchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

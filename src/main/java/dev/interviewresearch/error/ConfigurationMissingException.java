package dev.interviewresearch.error;

/**
 * A credential or capability the job needs is not configured. Never retried.
 */
public class ConfigurationMissingException extends ResearchException {

    public ConfigurationMissingException(String message) {
        super("CONFIG_MISSING", message);
    }
}

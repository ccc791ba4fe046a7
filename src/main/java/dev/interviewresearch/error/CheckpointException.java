package dev.interviewresearch.error;

/**
 * A persistence checkpoint failed or timed out.
 */
public class CheckpointException extends ResearchException {

    private final String checkpoint;

    public CheckpointException(String checkpoint, String message, Throwable cause) {
        super("CHECKPOINT_FAILED", message, cause);
        this.checkpoint = checkpoint;
    }

    public String getCheckpoint() {
        return checkpoint;
    }
}

package dev.interviewresearch.error;

/**
 * The synthesis call produced no result. Fatal to the job.
 */
public class SynthesisFailedException extends ResearchException {

    public SynthesisFailedException(String message) {
        super("SYNTHESIS_FAILED", message);
    }
}

package dev.interviewresearch.progress;

/**
 * Named milestones of a research run and the percentage each one reports.
 */
public enum ProgressStep {
    INITIALIZING("Initializing research", 5),
    GATHER_START("Gathering company, role and CV research", 15),
    GATHER_COMPLETE("Research gathered", 30),
    RAW_DATA_SAVED("Raw research saved", 35),
    SYNTHESIS_START("Synthesizing interview preparation", 75),
    SYNTHESIS_COMPLETE("Synthesis complete", 85),
    PERSIST_START("Saving interview stages and questions", 90),
    PERSIST_COMPLETE("Interview preparation saved", 95),
    COMPLETED("Research complete", 100);

    private final String label;
    private final int percentage;

    ProgressStep(String label, int percentage) {
        this.label = label;
        this.percentage = percentage;
    }

    public String label() {
        return label;
    }

    public int percentage() {
        return percentage;
    }
}

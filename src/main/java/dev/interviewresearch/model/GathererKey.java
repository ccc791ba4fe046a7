package dev.interviewresearch.model;

/**
 * Identity of each gatherer. Results are combined by key, never by arrival order.
 */
public enum GathererKey {
    COMPANY_RESEARCH("company_research"),
    JOB_REQUIREMENTS("job_requirements"),
    CV_ANALYSIS("cv_analysis");

    private final String metricName;

    GathererKey(String metricName) {
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }
}

package dev.interviewresearch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for research jobs.
 */
@Component
public class ResearchMetrics {

    private static final String TAG_GATHERER = "gatherer";
    private static final String TAG_SERVICE = "service";
    private final MeterRegistry registry;

    // Counters
    private final Counter jobsStartedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;
    private final Counter freshSearchesCounter;

    // Timers (per gatherer)
    private final ConcurrentHashMap<String, Timer> gathererTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger activeJobs = new AtomicInteger(0);

    public ResearchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.jobsStartedCounter = Counter.builder("research_jobs_started_total")
                .description("Total research jobs started")
                .register(registry);

        this.jobsCompletedCounter = Counter.builder("research_jobs_completed_total")
                .description("Total research jobs that reached completed")
                .register(registry);

        this.jobsFailedCounter = Counter.builder("research_jobs_failed_total")
                .description("Total research jobs that reached failed")
                .register(registry);

        this.cacheHitsCounter = Counter.builder("research_cache_hits_total")
                .description("Cached documents reused instead of fetched")
                .register(registry);

        this.cacheMissesCounter = Counter.builder("research_cache_misses_total")
                .description("Cache lookups that returned too little content")
                .register(registry);

        this.freshSearchesCounter = Counter.builder("research_fresh_searches_total")
                .description("Search queries issued to the external search service")
                .register(registry);

        Gauge.builder("research_jobs_active", activeJobs, AtomicInteger::get)
                .description("Research jobs currently running")
                .register(registry);
    }

    /**
     * Get or create a latency timer for a gatherer.
     */
    public Timer getGathererTimer(String gatherer) {
        return gathererTimers.computeIfAbsent(gatherer, name ->
                Timer.builder("research_gatherer_duration")
                        .description("Time spent in one gatherer")
                        .tag(TAG_GATHERER, name)
                        .register(registry)
        );
    }

    public void recordJobStarted() {
        jobsStartedCounter.increment();
        activeJobs.incrementAndGet();
    }

    public void recordJobCompleted() {
        jobsCompletedCounter.increment();
        activeJobs.decrementAndGet();
    }

    public void recordJobFailed(String errorCode) {
        jobsFailedCounter.increment();
        activeJobs.decrementAndGet();
        Counter.builder("research_jobs_failed_by_reason_total")
                .tag("reason", errorCode)
                .register(registry)
                .increment();
    }

    /**
     * Record the settled outcome of one gatherer (ok, skipped, failed, abandoned).
     */
    public void recordGatherOutcome(String gatherer, String outcome, Duration elapsed) {
        Counter.builder("research_gatherer_outcomes_total")
                .tag(TAG_GATHERER, gatherer)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        getGathererTimer(gatherer).record(elapsed);
    }

    public void recordCacheHits(int count) {
        cacheHitsCounter.increment(count);
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    public void recordFreshSearch() {
        freshSearchesCounter.increment();
    }

    /**
     * Record a call to an external service.
     */
    public void recordExternalCall(String service) {
        Counter.builder("research_external_calls_total")
                .tag(TAG_SERVICE, service)
                .register(registry)
                .increment();
    }

    public void recordExternalError(String service) {
        Counter.builder("research_external_errors_total")
                .tag(TAG_SERVICE, service)
                .register(registry)
                .increment();
    }

    public void recordCheckpointFailure(String checkpoint) {
        Counter.builder("research_checkpoint_failures_total")
                .tag("checkpoint", checkpoint)
                .register(registry)
                .increment();
    }

    public int getActiveJobs() {
        return activeJobs.get();
    }
}

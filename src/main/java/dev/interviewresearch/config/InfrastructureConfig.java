package dev.interviewresearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Shared beans: wall clock for progress timestamps and the scheduler research runs are launched on.
 */
@Configuration
public class InfrastructureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler researchJobScheduler(JobConfig jobConfig) {
        return Schedulers.newBoundedElastic(jobConfig.getWorkerThreads(), Integer.MAX_VALUE, "research-job");
    }
}

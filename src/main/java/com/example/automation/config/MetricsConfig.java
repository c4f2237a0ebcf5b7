package com.example.automation.config;

import com.example.automation.domain.enums.LastRunStatus;
import com.example.automation.domain.repository.JobConfigRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring automation job health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by state (enabled, disabled, failing)
 * - Run durations and outcomes per job
 * - Retries and retry exhaustion
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String[] JOB_STATES = {"enabled", "disabled", "failing"};

    private final MeterRegistry meterRegistry;
    private final JobConfigRepository jobConfigRepository;

    private final Map<String, AtomicLong> jobCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var state : JOB_STATES) {
            jobCounters.put(state, new AtomicLong(0));

            Gauge.builder("automation_jobs", jobCounters.get(state), AtomicLong::get)
                    .tag("state", state)
                    .description("Number of automation jobs by state")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${automation.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        jobCounters.get("enabled").set(jobConfigRepository.countByEnabled(true));
        jobCounters.get("disabled").set(jobConfigRepository.countByEnabled(false));
        jobCounters.get("failing").set(jobConfigRepository.countByEnabledTrueAndLastRunStatusIn(
                EnumSet.of(LastRunStatus.FAILED, LastRunStatus.FAILED_MAX_RETRIES)));
    }

    /**
     * Create a timer for a job run
     */
    public Timer.Sample startJobTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job run time and outcome
     */
    public void recordJobRun(Timer.Sample sample, String jobName, boolean success) {
        sample.stop(Timer.builder("automation_job_execution_time")
                .tag("job", jobName)
                .tag("success", String.valueOf(success))
                .description("Automation job execution time")
                .register(meterRegistry));

        meterRegistry.counter("automation_job_runs",
                "job", jobName,
                "status", success ? "success" : "failed"
        ).increment();
    }

    /**
     * Record a firing that did not start a run
     */
    public void recordSkipped(String jobName, String reason) {
        meterRegistry.counter("automation_job_skipped", "job", jobName, "reason", reason).increment();
    }

    /**
     * Record retry
     */
    public void recordRetry(String jobName, int attemptNumber) {
        meterRegistry.counter("automation_job_retries",
                "job", jobName,
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    /**
     * Record max retries exceeded
     */
    public void recordMaxRetriesExceeded(String jobName) {
        meterRegistry.counter("automation_job_max_retries_exceeded", "job", jobName).increment();
    }
}

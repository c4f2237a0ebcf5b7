package com.example.automation.service.executor;

import com.example.automation.config.AutomationProperties;
import com.example.automation.config.MetricsConfig;
import com.example.automation.domain.enums.LastRunStatus;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.domain.repository.JobConfigUpdates;
import com.example.automation.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Arms delayed re-runs of failed jobs.
 * <p>
 * Delays come from the configured backoff table, indexed by the number of retries
 * already consumed and clamped to its last entry. The retry counter is persisted
 * before the timer is armed. At most one retry timer is pending per job name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryScheduler {

    private final TaskScheduler taskScheduler;
    private final JobConfigRepository configRepository;
    private final AutomationProperties properties;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> pendingRetries = new ConcurrentHashMap<>();

    /**
     * Schedule the next automatic attempt of a failed job, or mark it as exhausted.
     *
     * @param jobName     The failed job
     * @param retryAction Invocation of the executor to run when the delay elapses
     * @return true if a retry was armed, false if retries are exhausted or the job is unknown
     */
    public synchronized boolean scheduleRetry(String jobName, Runnable retryAction) {
        var exhausted = new AtomicBoolean();
        var updated = JobConfigUpdates.update(configRepository, jobName, config -> {
            exhausted.set(config.getRetryCount() >= config.getMaxRetries());
            if (exhausted.get()) {
                config.setLastRunStatus(LastRunStatus.FAILED_MAX_RETRIES);
            } else {
                config.setRetryCount(config.getRetryCount() + 1);
            }
        });
        if (updated.isEmpty()) {
            log.warn("Cannot schedule retry for unknown job {}", jobName);
            return false;
        }

        var config = updated.get();
        if (exhausted.get()) {
            log.error("Job {} exhausted its {} automatic retries", jobName, config.getMaxRetries());
            cancel(jobName);

            metricsConfig.recordMaxRetriesExceeded(jobName);
            slackAlertService.sendMaxRetriesExceededAlert(config, config.getLastRunDetails());
            return false;
        }

        var attempt = config.getRetryCount();
        var delay = backoffFor(attempt - 1);

        cancel(jobName);
        var runAt = clock.instant().plus(delay);
        var future = taskScheduler.schedule(() -> fireRetry(jobName, attempt, retryAction), runAt);
        if (future != null) {
            pendingRetries.put(jobName, future);
        }

        metricsConfig.recordRetry(jobName, attempt);
        log.info("Scheduled retry {}/{} for job {} in {}s (at {})",
                attempt, config.getMaxRetries(), jobName, delay.toSeconds(), runAt);
        return true;
    }

    /**
     * Cancel the pending retry of a job, if any
     *
     * @return true if a pending retry was cancelled
     */
    public synchronized boolean cancel(String jobName) {
        var future = pendingRetries.remove(jobName);
        if (future == null) {
            return false;
        }
        var cancelled = future.cancel(false);
        if (cancelled) {
            log.info("Cancelled pending retry for job {}", jobName);
        }
        return cancelled;
    }

    public synchronized void cancelAll() {
        pendingRetries.keySet().forEach(this::cancel);
    }

    public boolean hasPendingRetry(String jobName) {
        var future = pendingRetries.get(jobName);
        return future != null && !future.isDone();
    }

    /**
     * Delay before the retry that follows {@code retriesConsumed} earlier retries
     */
    Duration backoffFor(int retriesConsumed) {
        var table = properties.getRetryBackoff();
        return table.get(Math.min(retriesConsumed, table.size() - 1));
    }

    private void fireRetry(String jobName, int attempt, Runnable retryAction) {
        pendingRetries.remove(jobName);
        log.info("Running retry {} of job {}", attempt, jobName);
        try {
            retryAction.run();
        } catch (Throwable t) {
            log.error("Unexpected error while retrying job {}: {}", jobName, t.getMessage(), t);
        }
    }
}

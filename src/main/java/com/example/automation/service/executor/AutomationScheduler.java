package com.example.automation.service.executor;

import com.example.automation.config.AutomationProperties;
import com.example.automation.config.AutomationProperties.JobDefinition;
import com.example.automation.domain.entity.JobRunLog;
import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.domain.repository.JobConfigUpdates;
import com.example.automation.domain.repository.JobRunLogRepository;
import com.example.automation.service.JobConfigService;
import com.example.automation.service.alert.SlackAlertService;
import com.example.automation.service.handler.JobHandler;
import com.example.automation.service.handler.JobHandlerRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Process-level lifecycle of the automation engine.
 * <p>
 * On startup it recovers runs interrupted by a previous shutdown, seeds the job
 * catalog and registers every discovered handler under its persisted schedule.
 * On shutdown it stops all timers and pending retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationScheduler {

    static final String INTERRUPTED = "interrupted";

    private final AutomationProperties properties;
    private final JobConfigService jobConfigService;
    private final JobConfigRepository configRepository;
    private final JobRunLogRepository runLogRepository;
    private final JobHandlerRegistry handlerRegistry;
    private final JobRegistry jobRegistry;
    private final RetryScheduler retryScheduler;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Starting automation engine (zone {})", properties.getTimeZone());

        recoverInterruptedRuns();

        properties.getJobs().forEach(jobConfigService::seedIfAbsent);

        var registered = 0;
        for (var handler : handlerRegistry.getHandlers()) {
            var jobName = handler.getJobName();
            if (!properties.getJobs().containsKey(jobName)) {
                continue;
            }
            if (registerFromConfig(jobName, handler)) {
                registered++;
            }
        }

        log.info("Automation engine started: {} jobs in catalog, {} registered", properties.getJobs().size(), registered);
    }

    /**
     * Seed and register a single job outside the catalog bootstrap
     *
     * @return true if the job was registered
     */
    public boolean addJob(String jobName, JobDefinition definition, JobHandler handler) {
        jobConfigService.seedIfAbsent(jobName, definition);
        return registerFromConfig(jobName, handler);
    }

    /**
     * Mark RUNNING run logs older than the stale threshold as failed.
     * Such rows can only be left behind by a process that stopped mid-run.
     *
     * @return number of recovered entries
     */
    public int recoverInterruptedRuns() {
        var now = clock.instant();
        var cutoff = now.minus(Duration.ofMinutes(properties.getStaleRunThresholdMinutes()));
        var stale = runLogRepository.findByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff);
        if (stale.isEmpty()) {
            return 0;
        }

        for (var runLog : stale) {
            runLog.markFailed(INTERRUPTED, now);
            runLogRepository.save(runLog);
            log.warn("Marked run {} of job {} (started {}) as interrupted", runLog.getId(), runLog.getJobName(), runLog.getStartedAt());
        }

        slackAlertService.sendErrorAlert("Interrupted automation runs recovered",
                stale.size() + " run(s) were still marked running at startup and have been marked failed",
                String.join(", ", stale.stream().map(JobRunLog::getJobName).distinct().toList()));
        return stale.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping automation engine");
        retryScheduler.cancelAll();
        jobRegistry.unregisterAll();
    }

    private boolean registerFromConfig(String jobName, JobHandler handler) {
        var config = configRepository.findById(jobName).orElse(null);
        if (config == null) {
            log.warn("No config for job {}, not registering", jobName);
            return false;
        }

        try {
            jobRegistry.register(jobName, config.getCronSchedule(), handler);
        } catch (IllegalArgumentException e) {
            log.error("Could not register job {}: {}", jobName, e.getMessage());
            return false;
        }

        JobConfigUpdates.update(configRepository, jobName, jobConfigService::refreshNextRun);
        return true;
    }
}

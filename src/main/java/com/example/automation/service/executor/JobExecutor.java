package com.example.automation.service.executor;

import com.example.automation.config.MetricsConfig;
import com.example.automation.domain.entity.JobConfig;
import com.example.automation.domain.entity.JobRunLog;
import com.example.automation.domain.enums.LastRunStatus;
import com.example.automation.domain.enums.RunOutcomeStatus;
import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.enums.TriggerSource;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.domain.repository.JobConfigUpdates;
import com.example.automation.domain.repository.JobRunLogRepository;
import com.example.automation.dto.JobRunOutcome;
import com.example.automation.service.cron.CronExpressionEvaluator;
import com.example.automation.service.handler.JobHandler;
import com.example.automation.service.handler.JobResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Runs a job handler once with full lifecycle management.
 * <p>
 * Handles:
 * - Skipping scheduled and retry firings of disabled jobs
 * - Rejecting a second concurrent invocation of the same job
 * - Run log creation before and finalization after the handler
 * - Job config reconciliation (last outcome, retry counter, next run)
 * - Handing failures over to the retry scheduler
 * - Metrics recording
 * <p>
 * Nothing thrown by a handler, errors included, propagates out of {@link #execute}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutor {

    private final JobConfigRepository configRepository;
    private final JobRunLogRepository runLogRepository;
    private final CronExpressionEvaluator cronEvaluator;
    private final RetryScheduler retryScheduler;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Execute a job once.
     *
     * @param jobName The job name
     * @param handler The work to run
     * @param source  What triggered this run; manual runs ignore the enabled flag
     * @return Outcome of the run, or a not-started outcome when skipped or rejected
     */
    public JobRunOutcome execute(String jobName, JobHandler handler, TriggerSource source) {
        if (source.isRespectsEnabledFlag() && !isEnabled(jobName)) {
            log.info("Skipping {} run of job {}: job is disabled", source.getCode(), jobName);
            metricsConfig.recordSkipped(jobName, "disabled");
            return JobRunOutcome.notStarted(jobName, RunOutcomeStatus.SKIPPED_DISABLED, source);
        }

        if (!inFlight.add(jobName)) {
            log.warn("Job {} is already running, rejecting {} run", jobName, source.getCode());
            metricsConfig.recordSkipped(jobName, "already_running");
            return JobRunOutcome.notStarted(jobName, RunOutcomeStatus.ALREADY_RUNNING, source);
        }

        try {
            return run(jobName, handler, source);
        } finally {
            inFlight.remove(jobName);
        }
    }

    /**
     * Check if an invocation of the job is currently in flight
     */
    public boolean isRunning(String jobName) {
        return inFlight.contains(jobName);
    }

    private JobRunOutcome run(String jobName, JobHandler handler, TriggerSource source) {
        var timerSample = metricsConfig.startJobTimer();
        var runLog = createRunLog(jobName, source);

        log.info("Starting {} run of job {} (run {})", source.getCode(), jobName, runLog.getId());

        JobResult result;
        try {
            result = JobResult.normalize(handler.execute());
        } catch (Throwable t) {
            var outcome = handleFailure(jobName, handler, runLog, t);
            metricsConfig.recordJobRun(timerSample, jobName, false);
            return outcome;
        }

        var outcome = handleSuccess(jobName, runLog, result);
        metricsConfig.recordJobRun(timerSample, jobName, true);
        return outcome;
    }

    private JobRunOutcome handleSuccess(String jobName, JobRunLog runLog, JobResult result) {
        var endTime = clock.instant();
        runLog.markSucceeded(result.getProcessed(), result.getCreated(), result.getSkipped(), result.getDetails(), endTime);
        runLogRepository.save(runLog);

        log.info("Job {} completed in {}ms ({})", jobName, runLog.getDurationMs(), result.toSummary());

        updateConfig(jobName, config -> {
            config.setLastRunAt(runLog.getStartedAt());
            config.setLastRunStatus(LastRunStatus.SUCCESS);
            config.setLastRunDetails(result.toSummary());
            config.setRetryCount(0);
            // paused jobs have no next run
            config.setNextRunAt(config.isEnabled() ? cronEvaluator.nextRun(config.getCronSchedule(), endTime) : null);
        });

        // a success ends the failure streak
        retryScheduler.cancel(jobName);

        return buildOutcome(runLog, RunOutcomeStatus.SUCCESS);
    }

    private JobRunOutcome handleFailure(String jobName, JobHandler handler, JobRunLog runLog, Throwable error) {
        var errorMessage = describe(error);
        log.warn("Job {} failed: {}", jobName, errorMessage, error);

        // Finalize the run log first
        runLog.markFailed(errorMessage, clock.instant());
        runLogRepository.save(runLog);

        var updated = updateConfig(jobName, config -> {
            config.setLastRunAt(runLog.getStartedAt());
            config.setLastRunStatus(LastRunStatus.FAILED);
            config.setLastRunDetails(errorMessage);
        });

        if (updated.map(JobConfig::isEnabled).orElse(true)) {
            retryScheduler.scheduleRetry(jobName, () -> execute(jobName, handler, TriggerSource.RETRY));
        } else {
            log.info("Job {} is paused, not scheduling a retry", jobName);
        }

        return buildOutcome(runLog, RunOutcomeStatus.FAILED);
    }

    private Optional<JobConfig> updateConfig(String jobName, Consumer<JobConfig> update) {
        var updated = JobConfigUpdates.update(configRepository, jobName, update);
        if (updated.isEmpty()) {
            log.warn("No config row for job {}, run outcome recorded in run log only", jobName);
        }
        return updated;
    }

    private boolean isEnabled(String jobName) {
        return configRepository.findById(jobName)
                .map(JobConfig::isEnabled)
                .orElse(false);
    }

    private JobRunLog createRunLog(String jobName, TriggerSource source) {
        var runLog = JobRunLog.builder()
                .jobName(jobName)
                .status(RunStatus.RUNNING)
                .triggerSource(source)
                .startedAt(clock.instant())
                .build();

        return runLogRepository.save(runLog);
    }

    private JobRunOutcome buildOutcome(JobRunLog runLog, RunOutcomeStatus status) {
        return JobRunOutcome.builder()
                .jobName(runLog.getJobName())
                .status(status)
                .triggerSource(runLog.getTriggerSource())
                .runLogId(runLog.getId())
                .startedAt(runLog.getStartedAt())
                .durationMs(runLog.getDurationMs())
                .processed(runLog.getItemsProcessed())
                .created(runLog.getItemsCreated())
                .skipped(runLog.getItemsSkipped())
                .details(runLog.getDetails())
                .errorMessage(runLog.getErrorMessage())
                .build();
    }

    private static String describe(Throwable error) {
        var message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}

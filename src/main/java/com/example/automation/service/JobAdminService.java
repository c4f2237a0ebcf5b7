package com.example.automation.service;

import com.example.automation.domain.entity.JobConfig;
import com.example.automation.domain.entity.JobRunLog;
import com.example.automation.domain.enums.RunOutcomeStatus;
import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.enums.TriggerSource;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.domain.repository.JobConfigUpdates;
import com.example.automation.domain.repository.JobRunLogRepository;
import com.example.automation.dto.JobRunLogResponse;
import com.example.automation.dto.JobRunOutcome;
import com.example.automation.dto.JobStatusResponse;
import com.example.automation.dto.OperationResult;
import com.example.automation.dto.UpdateJobRequest;
import com.example.automation.mapper.JobMapper;
import com.example.automation.service.cron.CronExpressionEvaluator;
import com.example.automation.service.executor.JobExecutor;
import com.example.automation.service.executor.JobRegistry;
import com.example.automation.service.executor.RetryScheduler;
import com.example.automation.service.handler.JobHandler;
import com.example.automation.service.handler.JobHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Admin operations on automation jobs.
 * <p>
 * Provides:
 * - Pause, resume, manual run and reschedule, keeping the registry and config store in step
 * - Status projections merging config with live registry state
 * - Run history queries
 * <p>
 * Unknown jobs, invalid schedules and conflicts are reported as {@link OperationResult}s.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobAdminService {

    static final int DEFAULT_LOG_LIMIT = 50;
    static final int MAX_LOG_LIMIT = 500;

    private final JobConfigRepository configRepository;
    private final JobRunLogRepository runLogRepository;
    private final JobRegistry jobRegistry;
    private final JobHandlerRegistry handlerRegistry;
    private final JobExecutor jobExecutor;
    private final RetryScheduler retryScheduler;
    private final JobConfigService jobConfigService;
    private final CronExpressionEvaluator cronEvaluator;
    private final JobMapper jobMapper;

    // === Control ===

    /**
     * Disable a job: stop its timer and cancel any pending retry. Idempotent.
     * A run already in flight completes normally.
     */
    public OperationResult<JobStatusResponse> pause(String jobName) {
        var updated = JobConfigUpdates.update(configRepository, jobName, config -> {
            config.setEnabled(false);
            jobConfigService.refreshNextRun(config);
        });
        if (updated.isEmpty()) {
            return notFound(jobName);
        }

        jobRegistry.stop(jobName);
        retryScheduler.cancel(jobName);

        log.info("Paused job {}", jobName);
        return OperationResult.ok(toStatus(updated.get()), "Job paused");
    }

    /**
     * Enable a job, clear its retry counter and restart its timer.
     * A retry left over from before the pause is cancelled.
     */
    public OperationResult<JobStatusResponse> resume(String jobName) {
        var updated = JobConfigUpdates.update(configRepository, jobName, config -> {
            config.setEnabled(true);
            config.setRetryCount(0);
            jobConfigService.refreshNextRun(config);
        });
        if (updated.isEmpty()) {
            return notFound(jobName);
        }

        retryScheduler.cancel(jobName);
        jobRegistry.start(jobName);

        log.info("Resumed job {}", jobName);
        return OperationResult.ok(toStatus(updated.get()), "Job resumed");
    }

    /**
     * Run a job immediately, regardless of its enabled flag.
     * The retry counter is reset and any pending retry cancelled before the run.
     * The run's outcome is returned to the caller.
     */
    public OperationResult<JobRunOutcome> triggerNow(String jobName) {
        if (configRepository.findById(jobName).isEmpty()) {
            return notFound(jobName);
        }

        Optional<JobHandler> handler = jobRegistry.getHandler(jobName)
                .or(() -> handlerRegistry.getHandler(jobName));
        if (handler.isEmpty()) {
            log.warn("Manual run of job {} requested but no handler is registered", jobName);
            return OperationResult.notFound("No handler registered for job: " + jobName);
        }

        if (jobExecutor.isRunning(jobName)) {
            log.warn("Manual run of job {} rejected: a run is already in progress", jobName);
            return OperationResult.alreadyRunning(null, "Job is already running: " + jobName);
        }

        retryScheduler.cancel(jobName);
        JobConfigUpdates.update(configRepository, jobName, config -> config.setRetryCount(0));

        log.info("Manually triggering job {}", jobName);
        var outcome = jobExecutor.execute(jobName, handler.get(), TriggerSource.MANUAL);

        if (outcome.getStatus() == RunOutcomeStatus.ALREADY_RUNNING) {
            return OperationResult.alreadyRunning(outcome, "Job is already running: " + jobName);
        }
        if (outcome.isSuccess()) {
            return OperationResult.ok(outcome, "Job completed in " + outcome.getDurationMs() + "ms");
        }
        return OperationResult.failed(outcome, "Job failed: " + outcome.getErrorMessage());
    }

    /**
     * Change a job's schedule. Nothing is changed when the expression is invalid.
     */
    public OperationResult<JobStatusResponse> reschedule(String jobName, String schedule) {
        if (configRepository.findById(jobName).isEmpty()) {
            return notFound(jobName);
        }
        if (!cronEvaluator.isValid(schedule)) {
            log.warn("Rejected schedule '{}' for job {}", schedule, jobName);
            return OperationResult.invalidSchedule("Invalid cron expression: " + schedule);
        }

        var normalized = schedule.trim().replaceAll("\\s+", " ");
        jobRegistry.reschedule(jobName, normalized);

        var updated = JobConfigUpdates.update(configRepository, jobName, config -> {
            config.setCronSchedule(normalized);
            jobConfigService.refreshNextRun(config);
        });
        if (updated.isEmpty()) {
            return notFound(jobName);
        }

        log.info("Job {} schedule changed to '{}'", jobName, normalized);
        return OperationResult.ok(toStatus(updated.get()), "Schedule updated");
    }

    /**
     * Apply a partial update: schedule first, then the enabled flag
     */
    public OperationResult<JobStatusResponse> updateJob(String jobName, UpdateJobRequest request) {
        if (request.getCronSchedule() == null && request.getEnabled() == null) {
            return OperationResult.invalidRequest("Nothing to update: provide enabled and/or cronSchedule");
        }
        if (!configRepository.existsById(jobName)) {
            return notFound(jobName);
        }

        OperationResult<JobStatusResponse> result = null;
        if (request.getCronSchedule() != null) {
            result = reschedule(jobName, request.getCronSchedule());
            if (!result.isOk()) {
                return result;
            }
        }
        if (request.getEnabled() != null) {
            result = request.getEnabled() ? resume(jobName) : pause(jobName);
        }
        return OperationResult.ok(result.getData(), "Job updated");
    }

    // === Status ===

    public OperationResult<JobStatusResponse> getStatus(String jobName) {
        return configRepository.findById(jobName)
                .map(config -> OperationResult.ok(toStatus(config), null))
                .orElseGet(() -> notFound(jobName));
    }

    /**
     * Status of every configured job, ordered by category then name
     */
    public List<JobStatusResponse> getAllStatuses() {
        return configRepository.findAllByOrderByCategoryAscJobNameAsc().stream()
                .map(this::toStatus)
                .toList();
    }

    // === Run history ===

    /**
     * Run history of one job, newest first
     */
    public OperationResult<List<JobRunLogResponse>> getRunLogs(String jobName, Integer limit) {
        var config = configRepository.findById(jobName).orElse(null);
        if (config == null) {
            return notFound(jobName);
        }

        var logs = runLogRepository.findByJobNameOrderByStartedAtDesc(jobName, PageRequest.of(0, clampLimit(limit)));
        var responses = jobMapper.toRunLogResponses(logs);
        responses.forEach(response -> enrich(response, config));
        return OperationResult.ok(responses, null);
    }

    /**
     * Recent runs across all jobs, optionally filtered by status and job name
     */
    public List<JobRunLogResponse> getRecentRuns(Integer limit, RunStatus status, String jobName) {
        var page = PageRequest.of(0, clampLimit(limit));

        List<JobRunLog> logs;
        if (jobName != null && status != null) {
            logs = runLogRepository.findByJobNameAndStatusOrderByStartedAtDesc(jobName, status, page);
        } else if (jobName != null) {
            logs = runLogRepository.findByJobNameOrderByStartedAtDesc(jobName, page);
        } else if (status != null) {
            logs = runLogRepository.findByStatusOrderByStartedAtDesc(status, page);
        } else {
            logs = runLogRepository.findAllByOrderByStartedAtDesc(page);
        }

        Map<String, JobConfig> configs = configRepository.findAll().stream()
                .collect(Collectors.toMap(JobConfig::getJobName, Function.identity()));

        var responses = jobMapper.toRunLogResponses(logs);
        responses.forEach(response -> enrich(response, configs.get(response.getJobName())));
        return responses;
    }

    // === Helpers ===

    private JobStatusResponse toStatus(JobConfig config) {
        var jobName = config.getJobName();
        var status = jobMapper.toStatusResponse(config);
        status.setRegistered(jobRegistry.isRegistered(jobName));
        status.setActive(jobRegistry.isActive(jobName));
        status.setRetryPending(retryScheduler.hasPendingRetry(jobName));
        status.setRunning(jobExecutor.isRunning(jobName));
        return status;
    }

    private void enrich(JobRunLogResponse response, JobConfig config) {
        if (config != null) {
            response.setDisplayName(config.getDisplayName());
            response.setCategory(config.getCategory());
        }
    }

    private static int clampLimit(Integer limit) {
        if (limit == null || limit < 1) {
            return DEFAULT_LOG_LIMIT;
        }
        return Math.min(limit, MAX_LOG_LIMIT);
    }

    private static <T> OperationResult<T> notFound(String jobName) {
        log.warn("Job not found: {}", jobName);
        return OperationResult.notFound("Job not found: " + jobName);
    }
}

package com.example.automation.controller;

import com.example.automation.domain.enums.OperationStatus;
import com.example.automation.domain.enums.RunStatus;
import com.example.automation.dto.*;
import com.example.automation.service.AutomationStatisticsService;
import com.example.automation.service.JobAdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * REST API controller for automation job administration.
 * <p>
 * Provides endpoints for:
 * - Listing job status
 * - Pausing, resuming, rescheduling and manually running jobs
 * - Run history and statistics
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/automation")
@Tag(name = "Automation", description = "APIs for managing automation jobs")
public class AutomationController {

    private static final Map<OperationStatus, HttpStatus> HTTP_STATUS = new EnumMap<>(Map.of(
            OperationStatus.OK, HttpStatus.OK,
            OperationStatus.NOT_FOUND, HttpStatus.NOT_FOUND,
            OperationStatus.INVALID_SCHEDULE, HttpStatus.BAD_REQUEST,
            OperationStatus.INVALID_REQUEST, HttpStatus.BAD_REQUEST,
            OperationStatus.ALREADY_RUNNING, HttpStatus.CONFLICT,
            OperationStatus.FAILED, HttpStatus.INTERNAL_SERVER_ERROR
    ));

    private final JobAdminService jobAdminService;
    private final AutomationStatisticsService statisticsService;

    // === Job Status ===

    @GetMapping("/jobs")
    @Operation(summary = "List jobs", description = "Status of every configured automation job")
    public ResponseEntity<ApiResponse<List<JobStatusResponse>>> getJobs() {
        return ResponseEntity.ok(ApiResponse.success(jobAdminService.getAllStatuses()));
    }

    @GetMapping("/jobs/{jobName}")
    @Operation(summary = "Get job", description = "Status of a single automation job")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getJob(@Parameter(description = "Job name") @PathVariable String jobName) {
        return toResponse(jobAdminService.getStatus(jobName));
    }

    // === Job Control ===

    @PatchMapping("/jobs/{jobName}")
    @Operation(summary = "Update job", description = "Change the enabled flag and/or the cron schedule of a job")
    public ResponseEntity<ApiResponse<JobStatusResponse>> updateJob(
            @Parameter(description = "Job name") @PathVariable String jobName,
            @Valid @RequestBody UpdateJobRequest request) {
        log.info("API: Update job {} (enabled: {}, schedule: {})", jobName, request.getEnabled(), request.getCronSchedule());

        return toResponse(jobAdminService.updateJob(jobName, request));
    }

    @PostMapping("/jobs/{jobName}/pause")
    @Operation(summary = "Pause job", description = "Stop scheduled and retry runs of a job")
    public ResponseEntity<ApiResponse<JobStatusResponse>> pauseJob(@Parameter(description = "Job name") @PathVariable String jobName) {
        log.info("API: Pause job {}", jobName);

        return toResponse(jobAdminService.pause(jobName));
    }

    @PostMapping("/jobs/{jobName}/resume")
    @Operation(summary = "Resume job", description = "Re-enable a paused job and reset its retry counter")
    public ResponseEntity<ApiResponse<JobStatusResponse>> resumeJob(@Parameter(description = "Job name") @PathVariable String jobName) {
        log.info("API: Resume job {}", jobName);

        return toResponse(jobAdminService.resume(jobName));
    }

    @PostMapping("/jobs/{jobName}/run")
    @Operation(summary = "Run job now", description = "Run a job immediately, even when paused, and return its outcome")
    public ResponseEntity<ApiResponse<JobRunOutcome>> runJob(@Parameter(description = "Job name") @PathVariable String jobName) {
        log.info("API: Run job {}", jobName);

        return toResponse(jobAdminService.triggerNow(jobName));
    }

    // === History ===

    @GetMapping("/jobs/{jobName}/logs")
    @Operation(summary = "Job run history", description = "Most recent runs of a job, newest first")
    public ResponseEntity<ApiResponse<List<JobRunLogResponse>>> getJobLogs(
            @Parameter(description = "Job name") @PathVariable String jobName,
            @Parameter(description = "Maximum entries") @RequestParam(required = false) Integer limit) {
        return toResponse(jobAdminService.getRunLogs(jobName, limit));
    }

    @GetMapping("/runs")
    @Operation(summary = "Recent runs", description = "Most recent runs across all jobs")
    public ResponseEntity<ApiResponse<List<JobRunLogResponse>>> getRecentRuns(
            @Parameter(description = "Maximum entries") @RequestParam(required = false) Integer limit,
            @Parameter(description = "Status filter") @RequestParam(required = false) RunStatus status,
            @Parameter(description = "Job name filter") @RequestParam(required = false) String jobName) {
        return ResponseEntity.ok(ApiResponse.success(jobAdminService.getRecentRuns(limit, status, jobName)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Statistics", description = "Aggregate run statistics")
    public ResponseEntity<ApiResponse<AutomationStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(statisticsService.getStatistics()));
    }

    private <T> ResponseEntity<ApiResponse<T>> toResponse(OperationResult<T> result) {
        if (result.isOk()) {
            return ResponseEntity.ok(ApiResponse.success(result.getData(), result.getMessage()));
        }
        return ResponseEntity.status(HTTP_STATUS.get(result.getStatus()))
                .body(ApiResponse.failure(result.getData(), result.getMessage()));
    }
}

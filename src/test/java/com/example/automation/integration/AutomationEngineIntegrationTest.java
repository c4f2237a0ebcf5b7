package com.example.automation.integration;

import com.example.automation.domain.entity.JobRunLog;
import com.example.automation.domain.enums.LastRunStatus;
import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.enums.TriggerSource;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.domain.repository.JobRunLogRepository;
import com.example.automation.service.JobAdminService;
import com.example.automation.service.executor.AutomationScheduler;
import com.example.automation.service.executor.JobExecutor;
import com.example.automation.service.executor.JobRegistry;
import com.example.automation.service.executor.RetryScheduler;
import com.example.automation.service.handler.JobResult;
import com.example.automation.service.handler.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Automation Engine Integration Tests")
class AutomationEngineIntegrationTest {

    private static final String JOB = "daily-shift-reminders";
    private static final String BASE = "/api/v1/automation";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JobConfigRepository configRepository;

    @Autowired
    private JobRunLogRepository runLogRepository;

    @Autowired
    private JobAdminService adminService;

    @Autowired
    private JobExecutor jobExecutor;

    @Autowired
    private JobRegistry jobRegistry;

    @Autowired
    private RetryScheduler retryScheduler;

    @Autowired
    private AutomationScheduler automationScheduler;

    @Autowired
    private ControllableJob reminderJob;

    @TestConfiguration
    static class TestJobs {

        @Bean
        ControllableJob reminderJob() {
            return new ControllableJob();
        }
    }

    /**
     * Stand-in for the shift reminder handler whose outcome the test controls
     */
    static class ControllableJob implements ScheduledJob {

        private final AtomicBoolean failing = new AtomicBoolean();
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public String getJobName() {
            return JOB;
        }

        @Override
        public JobResult execute() {
            calls.incrementAndGet();
            if (failing.get()) {
                throw new IllegalStateException("SMS gateway unavailable");
            }
            return JobResult.of(2, 1, 0).withDetails("reminders sent");
        }
    }

    @BeforeEach
    void setUp() {
        retryScheduler.cancelAll();
        runLogRepository.deleteAll();
        adminService.reschedule(JOB, "0 7 * * *");
        adminService.resume(JOB);
        reminderJob.failing.set(false);
        reminderJob.calls.set(0);
    }

    @Nested
    @DisplayName("Startup")
    class StartupTests {

        @Test
        @DisplayName("Should seed the whole catalog and register jobs with handlers")
        void shouldSeedCatalog() throws Exception {
            assertThat(configRepository.count()).isEqualTo(14);
            assertThat(jobRegistry.isActive(JOB)).isTrue();
            assertThat(jobRegistry.isRegistered("automation-log-cleanup")).isTrue();

            mockMvc.perform(get(BASE + "/jobs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data", hasSize(14)))
                    .andExpect(jsonPath("$.data[?(@.jobName == 'weekly-summary')].registered", contains(false)))
                    .andExpect(jsonPath("$.data[?(@.jobName == 'daily-shift-reminders')].registered", contains(true)));
        }

        @Test
        @DisplayName("Should mark runs left running by a previous process as interrupted")
        void shouldRecoverInterruptedRuns() {
            // Given
            var stale = runLogRepository.save(JobRunLog.builder()
                    .jobName(JOB)
                    .status(RunStatus.RUNNING)
                    .triggerSource(TriggerSource.SCHEDULED)
                    .startedAt(Instant.now().minus(Duration.ofHours(2)))
                    .build());
            var fresh = runLogRepository.save(JobRunLog.builder()
                    .jobName(JOB)
                    .status(RunStatus.RUNNING)
                    .triggerSource(TriggerSource.MANUAL)
                    .startedAt(Instant.now().minus(Duration.ofMinutes(5)))
                    .build());

            // When
            var recovered = automationScheduler.recoverInterruptedRuns();

            // Then
            assertThat(recovered).isEqualTo(1);
            var reloaded = runLogRepository.findById(stale.getId()).orElseThrow();
            assertThat(reloaded.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(reloaded.getErrorMessage()).isEqualTo("interrupted");
            assertThat(runLogRepository.findById(fresh.getId()).orElseThrow().getStatus()).isEqualTo(RunStatus.RUNNING);
        }
    }

    @Nested
    @DisplayName("Job control API")
    class ControlApiTests {

        @Test
        @DisplayName("Should run a paused job manually without re-enabling it")
        void shouldRunPausedJobManually() throws Exception {
            mockMvc.perform(post(BASE + "/jobs/" + JOB + "/pause"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.enabled").value(false))
                    .andExpect(jsonPath("$.data.active").value(false));

            mockMvc.perform(post(BASE + "/jobs/" + JOB + "/run"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("SUCCESS"))
                    .andExpect(jsonPath("$.data.processed").value(2))
                    .andExpect(jsonPath("$.data.created").value(1));

            assertThat(reminderJob.calls).hasValue(1);
            var config = configRepository.findById(JOB).orElseThrow();
            assertThat(config.isEnabled()).isFalse();
            assertThat(config.getLastRunStatus()).isEqualTo(LastRunStatus.SUCCESS);
            assertThat(config.getNextRunAt()).isNull();

            mockMvc.perform(get(BASE + "/jobs/" + JOB + "/logs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].triggerSource").value("MANUAL"))
                    .andExpect(jsonPath("$.data[0].displayName").value("Daily Shift Reminders"));
        }

        // max_retries = 3 counts automatic retries: the original failure plus three failed retries
        // reaches failed_max_retries, and no further retry is armed after that
        @Test
        @DisplayName("Should escalate a failure streak and reset it on a manual run")
        void shouldEscalateFailureStreak() throws Exception {
            // Given
            reminderJob.failing.set(true);

            // When: original failure
            mockMvc.perform(post(BASE + "/jobs/" + JOB + "/run"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.data.errorMessage").value("SMS gateway unavailable"));

            assertThat(configRepository.findById(JOB).orElseThrow().getRetryCount()).isEqualTo(1);
            assertThat(retryScheduler.hasPendingRetry(JOB)).isTrue();

            // When: the three automatic retries fail too
            for (int i = 0; i < 3; i++) {
                jobExecutor.execute(JOB, reminderJob, TriggerSource.RETRY);
            }

            // Then
            var exhausted = configRepository.findById(JOB).orElseThrow();
            assertThat(exhausted.getRetryCount()).isEqualTo(3);
            assertThat(exhausted.getLastRunStatus()).isEqualTo(LastRunStatus.FAILED_MAX_RETRIES);
            assertThat(retryScheduler.hasPendingRetry(JOB)).isFalse();
            assertThat(runLogRepository.count()).isEqualTo(4);

            // When: operator fixes the cause and runs the job
            reminderJob.failing.set(false);
            mockMvc.perform(post(BASE + "/jobs/" + JOB + "/run"))
                    .andExpect(status().isOk());

            // Then
            var recovered = configRepository.findById(JOB).orElseThrow();
            assertThat(recovered.getRetryCount()).isZero();
            assertThat(recovered.getLastRunStatus()).isEqualTo(LastRunStatus.SUCCESS);
            assertThat(recovered.getLastRunDetails()).isEqualTo("processed=2, created=1, skipped=0: reminders sent");
        }

        @Test
        @DisplayName("Should not arm a retry when a paused job fails a manual run")
        void shouldNotRetryPausedJob() throws Exception {
            // Given
            adminService.pause(JOB);
            reminderJob.failing.set(true);

            // When
            mockMvc.perform(post(BASE + "/jobs/" + JOB + "/run"))
                    .andExpect(status().isInternalServerError());

            // Then
            var config = configRepository.findById(JOB).orElseThrow();
            assertThat(config.isEnabled()).isFalse();
            assertThat(config.getLastRunStatus()).isEqualTo(LastRunStatus.FAILED);
            assertThat(config.getRetryCount()).isZero();
            assertThat(retryScheduler.hasPendingRetry(JOB)).isFalse();
        }

        @Test
        @DisplayName("Should reject an invalid schedule without changing the job")
        void shouldRejectInvalidSchedule() throws Exception {
            mockMvc.perform(patch(BASE + "/jobs/" + JOB)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"cronSchedule\": \"61 * * * *\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.message").value("Invalid cron expression: 61 * * * *"));

            mockMvc.perform(get(BASE + "/jobs/" + JOB))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.cronSchedule").value("0 7 * * *"));
            assertThat(jobRegistry.getSchedule(JOB)).contains("0 7 * * *");
        }

        @Test
        @DisplayName("Should apply a schedule change and pause in one update")
        void shouldApplyPartialUpdate() throws Exception {
            mockMvc.perform(patch(BASE + "/jobs/" + JOB)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"cronSchedule\": \"30 6 * * 5\", \"enabled\": false}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.cronSchedule").value("30 6 * * 5"))
                    .andExpect(jsonPath("$.data.enabled").value(false))
                    .andExpect(jsonPath("$.data.active").value(false));

            assertThat(jobRegistry.getSchedule(JOB)).contains("30 6 * * 5");
            assertThat(configRepository.findById(JOB).orElseThrow().getNextRunAt()).isNull();
        }

        @Test
        @DisplayName("Should reject malformed and empty update bodies")
        void shouldRejectBadUpdateBodies() throws Exception {
            mockMvc.perform(patch(BASE + "/jobs/" + JOB)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Malformed request body"));

            mockMvc.perform(patch(BASE + "/jobs/" + JOB)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should return 404 for unknown jobs")
        void shouldReturnNotFoundForUnknownJobs() throws Exception {
            mockMvc.perform(get(BASE + "/jobs/ghost"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Job not found: ghost"));

            mockMvc.perform(post(BASE + "/jobs/ghost/run"))
                    .andExpect(status().isNotFound());

            mockMvc.perform(post(BASE + "/jobs/ghost/pause"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should reject running a catalog job that has no handler")
        void shouldRejectJobWithoutHandler() throws Exception {
            mockMvc.perform(post(BASE + "/jobs/weekly-summary/run"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("No handler registered for job: weekly-summary"));
        }
    }

    @Nested
    @DisplayName("History API")
    class HistoryApiTests {

        @Test
        @DisplayName("Should report recent runs and statistics")
        void shouldReportRunsAndStatistics() throws Exception {
            adminService.triggerNow(JOB);

            mockMvc.perform(get(BASE + "/runs").param("status", "SUCCESS"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].jobName").value(JOB))
                    .andExpect(jsonPath("$.data[0].itemsProcessed").value(2));

            mockMvc.perform(get(BASE + "/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.today.count").value(1))
                    .andExpect(jsonPath("$.data.today.successCount").value(1))
                    .andExpect(jsonPath("$.data.today.totalProcessed").value(2))
                    .andExpect(jsonPath("$.data.month.totalCreated").value(1))
                    .andExpect(jsonPath("$.data.mostActive.count").value(1))
                    .andExpect(jsonPath("$.data.mostActive.displayName").value("Daily Shift Reminders"))
                    .andExpect(jsonPath("$.data.successRate").value(100))
                    .andExpect(jsonPath("$.data.mostActive.jobName").value(JOB))
                    .andExpect(jsonPath("$.data.runsOverTime", hasSize(14)))
                    .andExpect(jsonPath("$.data.jobCounts.total").value(14));
        }

        @Test
        @DisplayName("Should reject an unknown status filter")
        void shouldRejectUnknownStatusFilter() throws Exception {
            mockMvc.perform(get(BASE + "/runs").param("status", "EXPLODED"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));
        }
    }
}

package com.example.automation.domain.entity;

import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.enums.TriggerSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobRunLog Entity Tests")
class JobRunLogTest {

    private static final Instant STARTED = Instant.parse("2024-01-10T07:00:00Z");

    private JobRunLog runLog;

    @BeforeEach
    void setUp() {
        runLog = JobRunLog.builder()
                .jobName("daily-shift-reminders")
                .status(RunStatus.RUNNING)
                .triggerSource(TriggerSource.SCHEDULED)
                .startedAt(STARTED)
                .build();
    }

    @Test
    @DisplayName("New entry defaults counts to zero")
    void newEntryDefaultsCountsToZero() {
        assertThat(runLog.isRunning()).isTrue();
        assertThat(runLog.getItemsProcessed()).isZero();
        assertThat(runLog.getItemsCreated()).isZero();
        assertThat(runLog.getItemsSkipped()).isZero();
    }

    @Nested
    @DisplayName("Finalization")
    class FinalizationTests {

        @Test
        @DisplayName("Should record counts and duration on success")
        void shouldRecordCountsOnSuccess() {
            runLog.markSucceeded(10, 4, 2, "sent 4 reminders", STARTED.plusMillis(1500));

            assertThat(runLog.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(runLog.getItemsProcessed()).isEqualTo(10);
            assertThat(runLog.getItemsCreated()).isEqualTo(4);
            assertThat(runLog.getItemsSkipped()).isEqualTo(2);
            assertThat(runLog.getDetails()).isEqualTo("sent 4 reminders");
            assertThat(runLog.getCompletedAt()).isEqualTo(STARTED.plusMillis(1500));
            assertThat(runLog.getDurationMs()).isEqualTo(1500L);
        }

        @Test
        @DisplayName("Should record error on failure")
        void shouldRecordErrorOnFailure() {
            runLog.markFailed("connection refused", STARTED.plusSeconds(3));

            assertThat(runLog.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(runLog.getErrorMessage()).isEqualTo("connection refused");
            assertThat(runLog.getDurationMs()).isEqualTo(3000L);
        }

        @Test
        @DisplayName("Completed entries cannot be finalized again")
        void completedEntriesAreImmutable() {
            runLog.markSucceeded(1, 0, 0, null, STARTED.plusSeconds(1));

            assertThatThrownBy(() -> runLog.markFailed("late failure", STARTED.plusSeconds(2)))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> runLog.markSucceeded(2, 0, 0, null, STARTED.plusSeconds(2)))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(runLog.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(runLog.getItemsProcessed()).isEqualTo(1);
        }
    }
}

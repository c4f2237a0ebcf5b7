package com.example.automation.domain.entity;

import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.enums.TriggerSource;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of a single execution attempt.
 * Created as RUNNING when the attempt starts and finalized once; never updated afterwards.
 */
@Entity
@Table(name = "automation_run_log", indexes = {
        @Index(name = "idx_run_log_job_started", columnList = "job_name, started_at"),
        @Index(name = "idx_run_log_started_at", columnList = "started_at"),
        @Index(name = "idx_run_log_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRunLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", nullable = false, length = 20)
    private TriggerSource triggerSource;

    @Column(name = "items_processed", nullable = false)
    @Builder.Default
    private int itemsProcessed = 0;

    @Column(name = "items_created", nullable = false)
    @Builder.Default
    private int itemsCreated = 0;

    @Column(name = "items_skipped", nullable = false)
    @Builder.Default
    private int itemsSkipped = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "duration_ms")
    private Long durationMs;

    /**
     * Finalize as SUCCESS with the counts reported by the handler
     *
     * @throws IllegalStateException if the entry was already finalized
     */
    public void markSucceeded(int processed, int created, int skipped, String details, Instant completedAt) {
        assertRunning();
        this.status = RunStatus.SUCCESS;
        this.itemsProcessed = processed;
        this.itemsCreated = created;
        this.itemsSkipped = skipped;
        this.details = details;
        complete(completedAt);
    }

    /**
     * Finalize as FAILED
     *
     * @throws IllegalStateException if the entry was already finalized
     */
    public void markFailed(String errorMessage, Instant completedAt) {
        assertRunning();
        this.status = RunStatus.FAILED;
        this.errorMessage = errorMessage;
        complete(completedAt);
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    private void complete(Instant completedAt) {
        this.completedAt = completedAt;
        if (startedAt != null && completedAt != null) {
            this.durationMs = completedAt.toEpochMilli() - startedAt.toEpochMilli();
        }
    }

    private void assertRunning() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run log " + id + " is already completed with status " + status);
        }
    }
}

package com.example.automation.domain.entity;

import com.example.automation.domain.enums.JobCategory;
import com.example.automation.domain.enums.LastRunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Durable configuration and last-outcome summary of one automation job.
 * <p>
 * One row per job name. Created when the job is first seeded, mutated by every
 * run and by admin operations, never deleted during normal operation.
 */
@Entity
@Table(name = "automation_config", indexes = {
        @Index(name = "idx_automation_config_category", columnList = "category"),
        @Index(name = "idx_automation_config_enabled", columnList = "is_enabled")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobConfig {

    @Id
    @Column(name = "job_name", length = 100, updatable = false, nullable = false)
    private String jobName;

    // === Presentation metadata (immutable after seeding) ===

    @Column(name = "display_name", nullable = false, length = 200)
    private String displayName;

    @Column(name = "description", length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 30)
    private JobCategory category;

    // === Runtime settings ===

    /**
     * 5-field cron expression, mutable through reschedule
     */
    @Column(name = "cron_schedule", nullable = false, length = 100)
    private String cronSchedule;

    @Column(name = "is_enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /**
     * Automatic retries consumed by the current failure streak
     */
    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private int maxRetries = 3;

    // === Last outcome ===

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_run_status", length = 30)
    private LastRunStatus lastRunStatus;

    @Column(name = "last_run_details", columnDefinition = "TEXT")
    private String lastRunDetails;

    /**
     * Advisory projection of the next cron fire time
     */
    @Column(name = "next_run_at")
    private Instant nextRunAt;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Optimistic locking version, bumped on every write
     */
    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Check if another automatic retry is allowed
     */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /**
     * Check if the job is waiting on automatic retries
     */
    public boolean isFailing() {
        return lastRunStatus != null && lastRunStatus.isFailure();
    }
}

package com.example.automation.dto;

import com.example.automation.domain.enums.JobCategory;
import com.example.automation.domain.enums.LastRunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Job configuration merged with its live runtime state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private String jobName;
    private String displayName;
    private String description;
    private JobCategory category;
    private String cronSchedule;
    private boolean enabled;
    private int retryCount;
    private int maxRetries;
    private Instant lastRunAt;
    private LastRunStatus lastRunStatus;
    private String lastRunDetails;
    private Instant nextRunAt;
    private Instant updatedAt;

    // === Runtime state ===

    /**
     * A handler and timer are registered for this job in the running process
     */
    private boolean registered;

    /**
     * The job's timer is armed
     */
    private boolean active;

    private boolean retryPending;

    private boolean running;
}

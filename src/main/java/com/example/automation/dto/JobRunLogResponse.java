package com.example.automation.dto;

import com.example.automation.domain.enums.JobCategory;
import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.enums.TriggerSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a run log entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunLogResponse {

    private UUID id;
    private String jobName;
    private String displayName;
    private JobCategory category;
    private Instant startedAt;
    private Instant completedAt;
    private RunStatus status;
    private TriggerSource triggerSource;
    private int itemsProcessed;
    private int itemsCreated;
    private int itemsSkipped;
    private String errorMessage;
    private String details;
    private Long durationMs;
}

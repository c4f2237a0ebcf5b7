package com.example.automation.dto;

import com.example.automation.domain.enums.RunOutcomeStatus;
import com.example.automation.domain.enums.TriggerSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a single executor invocation, returned synchronously to manual triggers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunOutcome {

    private String jobName;
    private RunOutcomeStatus status;
    private TriggerSource triggerSource;

    /**
     * Id of the run log entry; null when no run was started
     */
    private UUID runLogId;

    private Instant startedAt;
    private Long durationMs;
    private int processed;
    private int created;
    private int skipped;
    private String details;
    private String errorMessage;

    public static JobRunOutcome notStarted(String jobName, RunOutcomeStatus status, TriggerSource source) {
        return JobRunOutcome.builder().jobName(jobName).status(status).triggerSource(source).build();
    }

    public boolean isSuccess() {
        return status == RunOutcomeStatus.SUCCESS;
    }
}

package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What caused a job run to start.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerSource {

    /**
     * Fired by the job's cron timer
     */
    SCHEDULED("scheduled", true),

    /**
     * Fired by a pending retry timer after a failure
     */
    RETRY("retry", true),

    /**
     * Requested by an operator through the admin API
     */
    MANUAL("manual", false);

    private final String code;

    /**
     * Whether runs from this source are skipped while the job is disabled
     */
    private final boolean respectsEnabledFlag;
}

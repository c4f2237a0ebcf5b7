package com.example.automation.domain.enums;

/**
 * Result of asking the executor to run a job once
 */
public enum RunOutcomeStatus {

    SUCCESS,

    FAILED,

    /**
     * Scheduled or retry firing for a disabled job; nothing was recorded
     */
    SKIPPED_DISABLED,

    /**
     * Another invocation of the same job was still in flight; nothing was recorded
     */
    ALREADY_RUNNING
}

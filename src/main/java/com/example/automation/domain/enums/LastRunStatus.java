package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Last recorded outcome of a job, as kept on its configuration row.
 */
@Getter
@RequiredArgsConstructor
public enum LastRunStatus {

    /**
     * Last attempt completed without error.
     */
    SUCCESS("success", "Success"),

    /**
     * Last attempt failed and automatic retries may still be pending.
     */
    FAILED("failed", "Failed"),

    /**
     * Automatic retries are exhausted.
     * Terminal until a manual trigger or a resume resets the retry counter.
     */
    FAILED_MAX_RETRIES("failed_max_retries", "Failed (max retries)");

    private final String code;
    private final String displayName;

    /**
     * Find LastRunStatus by its code value
     */
    public static LastRunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown last run status code: " + code);
    }

    public boolean isFailure() {
        return this == FAILED || this == FAILED_MAX_RETRIES;
    }
}

package com.example.automation.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a single run log entry.
 * An entry is created as RUNNING and finalized exactly once.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    RUNNING("running", "Running"),

    SUCCESS("success", "Success"),

    FAILED("failed", "Failed");

    private final String code;
    private final String displayName;

    /**
     * Find RunStatus by its code value
     */
    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}

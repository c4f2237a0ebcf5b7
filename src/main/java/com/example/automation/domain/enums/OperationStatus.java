package com.example.automation.domain.enums;

/**
 * Outcome classification of an admin operation
 */
public enum OperationStatus {
    OK,
    NOT_FOUND,
    INVALID_SCHEDULE,
    INVALID_REQUEST,
    ALREADY_RUNNING,
    FAILED
}

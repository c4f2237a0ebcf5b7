package com.example.automation.dto;

import com.example.automation.domain.enums.OperationStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Structured result of an admin operation.
 * Admin operations report unknown jobs, bad schedules and conflicts through this type instead of throwing.
 */
@Getter
@ToString
@AllArgsConstructor
public class OperationResult<T> {

    private final OperationStatus status;
    private final String message;
    private final T data;

    public static <T> OperationResult<T> ok(T data, String message) {
        return new OperationResult<>(OperationStatus.OK, message, data);
    }

    public static <T> OperationResult<T> notFound(String message) {
        return new OperationResult<>(OperationStatus.NOT_FOUND, message, null);
    }

    public static <T> OperationResult<T> invalidSchedule(String message) {
        return new OperationResult<>(OperationStatus.INVALID_SCHEDULE, message, null);
    }

    public static <T> OperationResult<T> invalidRequest(String message) {
        return new OperationResult<>(OperationStatus.INVALID_REQUEST, message, null);
    }

    public static <T> OperationResult<T> alreadyRunning(T data, String message) {
        return new OperationResult<>(OperationStatus.ALREADY_RUNNING, message, data);
    }

    public static <T> OperationResult<T> failed(T data, String message) {
        return new OperationResult<>(OperationStatus.FAILED, message, data);
    }

    public boolean isOk() {
        return status == OperationStatus.OK;
    }
}

package com.spendmonitor.monitor.domain.resilience;

import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;

/**
 * Outcome of a retried operation: either a value or the error that ended it, plus the
 * number of attempts actually made.
 */
public record ExecutionResult<T>(T value, SpendMonitorException error, int attempts) {

    public static <T> ExecutionResult<T> success(T value, int attempts) {
        return new ExecutionResult<>(value, null, attempts);
    }

    public static <T> ExecutionResult<T> failure(SpendMonitorException error, int attempts) {
        return new ExecutionResult<>(null, error, attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public ErrorKind errorKind() {
        return error == null ? null : error.kind();
    }

    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }
}

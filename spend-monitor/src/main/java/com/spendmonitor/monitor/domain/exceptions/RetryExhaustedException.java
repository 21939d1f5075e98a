package com.spendmonitor.monitor.domain.exceptions;

import lombok.Getter;

@Getter
public class RetryExhaustedException extends SpendMonitorException {

    private final int attempts;

    private RetryExhaustedException(String message, int attempts, Throwable lastError) {
        super(message, lastError);
        this.attempts = attempts;
    }

    public static RetryExhaustedException of(String operation, int attempts, Throwable lastError) {
        return new RetryExhaustedException(operation + " failed after " + attempts + " attempts: "
                + lastError.getMessage(), attempts, lastError);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RETRY_EXHAUSTED;
    }
}

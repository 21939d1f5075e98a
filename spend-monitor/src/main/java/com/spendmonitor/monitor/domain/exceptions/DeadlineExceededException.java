package com.spendmonitor.monitor.domain.exceptions;

import java.time.Duration;

public class DeadlineExceededException extends SpendMonitorException {

    private DeadlineExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DeadlineExceededException of(String operation, Duration remaining, Throwable lastError) {
        return new DeadlineExceededException(operation + " cannot retry within the remaining "
                + remaining.toMillis() + "ms", lastError);
    }

    public static DeadlineExceededException of(String operation) {
        return new DeadlineExceededException(operation + " started after its deadline", null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DEADLINE_EXCEEDED;
    }
}

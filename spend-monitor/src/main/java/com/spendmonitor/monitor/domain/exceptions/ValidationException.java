package com.spendmonitor.monitor.domain.exceptions;

public class ValidationException extends SpendMonitorException {

    protected ValidationException(String message) {
        super(message);
    }

    public static ValidationException of(String message) {
        return new ValidationException(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}

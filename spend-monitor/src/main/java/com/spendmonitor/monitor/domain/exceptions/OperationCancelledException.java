package com.spendmonitor.monitor.domain.exceptions;

public class OperationCancelledException extends SpendMonitorException {

    private OperationCancelledException(String message) {
        super(message);
    }

    public static OperationCancelledException of(String operation) {
        return new OperationCancelledException(operation + " was cancelled");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CANCELLED;
    }
}

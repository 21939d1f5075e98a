package com.spendmonitor.monitor.domain.exceptions;

public class TransientBackendException extends SpendMonitorException {

    private TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TransientBackendException of(String operation, Throwable cause) {
        return new TransientBackendException(operation + " failed transiently: " + cause.getMessage(), cause);
    }

    public static TransientBackendException of(String operation, String reason) {
        return new TransientBackendException(operation + " failed transiently: " + reason, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }
}

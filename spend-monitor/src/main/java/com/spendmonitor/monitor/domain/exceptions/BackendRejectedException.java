package com.spendmonitor.monitor.domain.exceptions;

/**
 * A backend refused the request in a way retrying cannot fix (bad parameters,
 * missing permissions, unparseable response).
 */
public class BackendRejectedException extends SpendMonitorException {

    protected BackendRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    public static BackendRejectedException of(String operation, Throwable cause) {
        return new BackendRejectedException(operation + " rejected: " + cause.getMessage(), cause);
    }

    public static BackendRejectedException of(String operation, String reason) {
        return new BackendRejectedException(operation + " rejected: " + reason, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FATAL;
    }
}

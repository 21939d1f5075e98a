package com.spendmonitor.monitor.domain.exceptions;

/**
 * Root of the error taxonomy. Every failure the pipeline reasons about carries an
 * {@link ErrorKind} so callers can branch on it without instanceof chains.
 */
public abstract class SpendMonitorException extends RuntimeException {

    protected SpendMonitorException(String message) {
        super(message);
    }

    protected SpendMonitorException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}

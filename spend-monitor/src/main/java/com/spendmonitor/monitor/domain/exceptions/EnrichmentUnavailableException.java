package com.spendmonitor.monitor.domain.exceptions;

public class EnrichmentUnavailableException extends SpendMonitorException {

    private final ErrorKind kind;

    private EnrichmentUnavailableException(String message, ErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static EnrichmentUnavailableException of(String operation, SpendMonitorException cause) {
        return new EnrichmentUnavailableException(
                operation + " unavailable: " + cause.getMessage(), cause.kind(), cause);
    }

    @Override
    public ErrorKind kind() {
        return kind;
    }
}

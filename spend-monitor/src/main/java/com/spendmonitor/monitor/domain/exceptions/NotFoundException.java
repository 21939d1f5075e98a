package com.spendmonitor.monitor.domain.exceptions;

public class NotFoundException extends SpendMonitorException {

    protected NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String message) {
        return new NotFoundException(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}

package com.spendmonitor.monitor.domain.exceptions;

import lombok.Getter;

@Getter
public class EndpointDisabledException extends BackendRejectedException {

    private final String endpointRef;

    private EndpointDisabledException(String endpointRef, Throwable cause) {
        super("Push endpoint " + endpointRef + " is disabled", cause);
        this.endpointRef = endpointRef;
    }

    public static EndpointDisabledException of(String endpointRef) {
        return new EndpointDisabledException(endpointRef, null);
    }

    public static EndpointDisabledException of(String endpointRef, Throwable cause) {
        return new EndpointDisabledException(endpointRef, cause);
    }
}

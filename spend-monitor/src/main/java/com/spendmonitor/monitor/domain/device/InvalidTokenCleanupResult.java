package com.spendmonitor.monitor.domain.device;

import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import java.util.List;

public record InvalidTokenCleanupResult(List<String> removed, List<CleanupError> errors) {

    public InvalidTokenCleanupResult {
        removed = List.copyOf(removed);
        errors = List.copyOf(errors);
    }

    public record CleanupError(String endpointRef, ErrorKind kind, String message) {}
}

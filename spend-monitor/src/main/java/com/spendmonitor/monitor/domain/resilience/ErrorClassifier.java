package com.spendmonitor.monitor.domain.resilience;

import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is worth another attempt.
 */
@FunctionalInterface
public interface ErrorClassifier {

    FailureClassification classify(Throwable error);

    /**
     * Transient and throttled backend errors retry, as do raw I/O failures and
     * timeouts; everything else is fatal.
     */
    static ErrorClassifier defaults() {
        return error -> {
            if (error instanceof SpendMonitorException sme) {
                return sme.kind() == ErrorKind.TRANSIENT || sme.kind() == ErrorKind.RATE_LIMITED
                        ? FailureClassification.RETRYABLE
                        : FailureClassification.FATAL;
            }
            if (error instanceof IOException
                    || error instanceof UncheckedIOException
                    || error instanceof TimeoutException) {
                return FailureClassification.RETRYABLE;
            }
            return FailureClassification.FATAL;
        };
    }
}

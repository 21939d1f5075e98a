package com.spendmonitor.monitor.domain.resilience;

import com.spendmonitor.monitor.domain.exceptions.BackendRejectedException;
import com.spendmonitor.monitor.domain.exceptions.DeadlineExceededException;
import com.spendmonitor.monitor.domain.exceptions.OperationCancelledException;
import com.spendmonitor.monitor.domain.exceptions.RetryExhaustedException;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded exponential backoff with jitter.
 *
 * <p>Attempt {@code n} (1-based) that fails retryably is followed by a wait of
 * {@code min(base * multiplier^(n-1), maxDelay)}, spread by up to {@code jitterRatio}
 * in either direction. A wait that would outlast the context deadline is not started:
 * the call fails with {@code DEADLINE_EXCEEDED} instead.
 */
@Slf4j
public class RetryPolicy {

    private final RetrySettings settings;
    private final DoubleSupplier jitterSource;

    public RetryPolicy(RetrySettings settings) {
        this(settings, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(RetrySettings settings, DoubleSupplier jitterSource) {
        this.settings = settings;
        this.jitterSource = jitterSource;
    }

    public <T> ExecutionResult<T> execute(String operation, Callable<T> call, ExecutionContext ctx) {
        return execute(operation, call, ErrorClassifier.defaults(), ctx);
    }

    public <T> ExecutionResult<T> execute(
            String operation, Callable<T> call, ErrorClassifier classifier, ExecutionContext ctx) {
        Exception lastError = null;
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            if (ctx.isCancelled()) {
                return ExecutionResult.failure(OperationCancelledException.of(operation), attempt - 1);
            }
            if (ctx.isExpired()) {
                var error = lastError == null
                        ? DeadlineExceededException.of(operation)
                        : DeadlineExceededException.of(operation, Duration.ZERO, lastError);
                return ExecutionResult.failure(error, attempt - 1);
            }
            try {
                return ExecutionResult.success(call.call(), attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.cancel();
                return ExecutionResult.failure(OperationCancelledException.of(operation), attempt);
            } catch (Exception e) {
                lastError = e;
                if (classifier.classify(e) == FailureClassification.FATAL) {
                    log.debug("{} failed fatally on attempt {}: {}", operation, attempt, e.getMessage());
                    return ExecutionResult.failure(asDomainError(operation, e), attempt);
                }
                if (attempt == settings.maxAttempts()) {
                    break;
                }
                var delay = delayAfter(attempt);
                var remaining = ctx.remaining();
                if (remaining.isPresent() && remaining.get().compareTo(delay) < 0) {
                    log.warn("{} giving up after attempt {}: backoff {}ms exceeds remaining {}ms",
                            operation, attempt, delay.toMillis(), remaining.get().toMillis());
                    return ExecutionResult.failure(
                            DeadlineExceededException.of(operation, remaining.get(), e), attempt);
                }
                log.warn("{} failed on attempt {}/{}, retrying in {}ms: {}",
                        operation, attempt, settings.maxAttempts(), delay.toMillis(), e.getMessage());
                if (!ctx.pause(delay)) {
                    return ExecutionResult.failure(OperationCancelledException.of(operation), attempt);
                }
            }
        }
        log.error("{} exhausted {} attempts: {}", operation, settings.maxAttempts(), lastError.getMessage());
        return ExecutionResult.failure(
                RetryExhaustedException.of(operation, settings.maxAttempts(), lastError),
                settings.maxAttempts());
    }

    Duration delayAfter(int attempt) {
        double base = settings.baseDelay().toMillis() * Math.pow(settings.multiplier(), attempt - 1);
        double capped = Math.min(base, settings.maxDelay().toMillis());
        double spread = capped * settings.jitterRatio() * (2 * jitterSource.getAsDouble() - 1);
        return Duration.ofMillis(Math.max(0L, Math.round(capped + spread)));
    }

    public RetrySettings settings() {
        return settings;
    }

    private static SpendMonitorException asDomainError(String operation, Exception e) {
        return e instanceof SpendMonitorException sme ? sme : BackendRejectedException.of(operation, e);
    }
}

package com.spendmonitor.monitor.domain.resilience;

import com.spendmonitor.monitor.domain.exceptions.OperationCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Deadline and cancellation signal shared by every step of one pipeline run.
 *
 * <p>All waits inside the pipeline go through {@link #pause(Duration)} so that a
 * cancel, a thread interrupt or the deadline ends them early.
 */
public final class ExecutionContext {

    private final Clock clock;
    private final Instant deadline;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    private ExecutionContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static ExecutionContext withTimeout(Clock clock, Duration timeout) {
        return new ExecutionContext(clock, clock.instant().plus(timeout));
    }

    public static ExecutionContext withDeadline(Clock clock, Instant deadline) {
        return new ExecutionContext(clock, deadline);
    }

    public static ExecutionContext unbounded(Clock clock) {
        return new ExecutionContext(clock, null);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left before the deadline, never negative. Empty when the context is unbounded.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        var left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw OperationCancelledException.of(operation);
        }
    }

    /**
     * Waits for the given duration.
     *
     * @return true if the full duration elapsed, false if the wait ended because the
     *     context was cancelled or the thread was interrupted
     */
    public boolean pause(Duration duration) {
        if (isCancelled()) {
            return false;
        }
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            return !cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }

    public Clock clock() {
        return clock;
    }
}

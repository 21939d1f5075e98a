package com.spendmonitor.monitor.domain.resilience;

import com.spendmonitor.monitor.domain.exceptions.OperationCancelledException;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import lombok.extern.slf4j.Slf4j;

/**
 * Sliding-log limiter: at most {@code maxCalls} permits are granted within any rolling
 * {@code window}. A caller that finds the window full waits for the oldest entry to age
 * out, as long as the wait fits before its context deadline.
 */
@Slf4j
public class RateLimiter {

    private final int maxCalls;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> grants = new ArrayDeque<>();

    public RateLimiter(int maxCalls, Duration window, Clock clock) {
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be at least 1");
        }
        this.maxCalls = maxCalls;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Blocks until a permit is granted.
     *
     * @throws RateLimitExceededException when the next free slot lies beyond the deadline
     * @throws OperationCancelledException when the context is cancelled while waiting
     */
    public void acquire(ExecutionContext ctx) {
        while (true) {
            ctx.throwIfCancelled("rate limiter wait");
            var wait = tryGrant();
            if (wait.isZero()) {
                return;
            }
            var remaining = ctx.remaining();
            if (remaining.isPresent() && remaining.get().compareTo(wait) < 0) {
                throw RateLimitExceededException.enrichmentWindow(maxCalls, window, wait);
            }
            log.debug("Rate limit reached, waiting {}ms for a free slot", wait.toMillis());
            if (!ctx.pause(wait)) {
                throw OperationCancelledException.of("rate limiter wait");
            }
        }
    }

    public boolean tryAcquire() {
        return tryGrant().isZero();
    }

    public synchronized int availablePermits() {
        evictExpired(clock.instant());
        return maxCalls - grants.size();
    }

    /**
     * Grants a permit and returns zero, or returns how long until one frees up.
     */
    private synchronized Duration tryGrant() {
        var now = clock.instant();
        evictExpired(now);
        if (grants.size() < maxCalls) {
            grants.addLast(now);
            return Duration.ZERO;
        }
        var wait = Duration.between(now, grants.peekFirst().plus(window));
        return wait.isZero() || wait.isNegative() ? Duration.ofMillis(1) : wait;
    }

    private void evictExpired(Instant now) {
        var cutoff = now.minus(window);
        while (!grants.isEmpty() && !grants.peekFirst().isAfter(cutoff)) {
            grants.removeFirst();
        }
    }
}

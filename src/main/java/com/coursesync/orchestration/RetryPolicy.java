package com.coursesync.orchestration;

import com.coursesync.error.CancelledException;
import com.coursesync.error.FetchException;
import com.coursesync.util.StopSignal;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential backoff for network calls. Only retryable
 * {@link FetchException}s are retried; everything else propagates on the first failure.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double multiplier
) {
    private static final Logger LOG = Logger.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff cannot be negative");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Backoff before attempt {@code attempt + 1}, without jitter.
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    public <T> T execute(String what, IoCall<T> call, StopSignal stop) throws IOException {
        for (int attempt = 1; ; attempt++) {
            stop.throwIfStopped(what);
            try {
                return call.call();
            } catch (FetchException e) {
                if (!e.retryable() || attempt >= maxAttempts || stop.isStopped()) {
                    throw e;
                }
                long backoffMs = backoffAfter(attempt).toMillis();
                // up to 10% jitter
                backoffMs += (long) (backoffMs * 0.1 * ThreadLocalRandom.current().nextDouble());
                LOG.warnf("%s failed (attempt %d/%d), retrying in %d ms: %s",
                        what, attempt, maxAttempts, backoffMs, e.getMessage());
                waitBeforeRetry(what, backoffMs, stop);
            }
        }
    }

    private static void waitBeforeRetry(String what, long backoffMs, StopSignal stop) throws CancelledException {
        try {
            if (stop.sleep(Duration.ofMillis(backoffMs))) {
                throw new CancelledException("Cancelled while waiting to retry " + what);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while waiting to retry " + what, e);
        }
    }

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws IOException;
    }
}

package tech.yump.rotator.rotation;

import lombok.extern.slf4j.Slf4j;
import tech.yump.rotator.config.RotatorProperties;
import tech.yump.rotator.executor.ExecutorException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Capped exponential backoff around the executor call of a cycle.
 * Only {@link ExecutorException}s marked retryable are repeated; everything else propagates at once.
 */
@Slf4j
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        this(maxAttempts, initialDelay, maxDelay, multiplier, duration -> Thread.sleep(duration.toMillis()));
    }

    RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(RotatorProperties.RetryProperties retry) {
        return new RetryPolicy(retry.maxAttempts(), retry.initialDelay(), retry.maxDelay(), retry.multiplier());
    }

    /**
     * A policy making a single attempt.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the given attempt (1-based); zero for the first one.
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        long delay = (long) (initialDelay.toMillis() * Math.pow(multiplier, attempt - 2));
        return Duration.ofMillis(Math.min(delay, maxDelay.toMillis()));
    }

    /**
     * Runs the action, repeating it after retryable executor failures until the attempts are used up.
     * Waiting is interrupted by cancellation.
     */
    public <T> T execute(Supplier<T> action, CancellationSignal signal) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (ExecutorException e) {
                if (!e.isRetryable() || attempt >= maxAttempts || signal.isCancelled()) {
                    throw e;
                }
                attempt++;
                Duration delay = delayBefore(attempt);
                log.warn("Retryable executor failure, attempt {} of {} in {} ms", attempt, maxAttempts, delay.toMillis());
                pause(delay, signal);
            }
        }
    }

    private void pause(Duration delay, CancellationSignal signal) {
        if (delay.isZero()) {
            return;
        }
        Thread caller = Thread.currentThread();
        try (CancellationSignal.Registration ignored = signal.onCancel(caller::interrupt)) {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            if (signal.isCancelled()) {
                throw ExecutorException.cancelled("retry wait");
            }
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while waiting to retry", e, false);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}

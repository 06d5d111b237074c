package io.github.depot2git.util;

import io.github.depot2git.ConversionException;
import io.github.depot2git.FatalConversionException;
import io.github.depot2git.RetryBudgetExhaustedException;
import io.github.depot2git.TransientCommandException;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Bounded retry with a fixed backoff. Only {@link TransientCommandException} is retried; anything else propagates
 * on the first attempt.
 */
public final class Retrier {
    private static final Logger logger = LogManager.getLogger(Retrier.class);

    public static final int DEFAULT_ATTEMPTS = 3;
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(3);

    @FunctionalInterface
    public interface Attempt<T> {
        /** @param attempt 1-based attempt number */
        T call(int attempt) throws ConversionException;
    }

    private final int maxAttempts;
    private final Duration delay;

    public Retrier(int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    public static Retrier defaults() {
        return new Retrier(DEFAULT_ATTEMPTS, DEFAULT_DELAY);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String operation, Attempt<T> attempt) throws ConversionException {
        @Nullable TransientCommandException last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            try {
                return attempt.call(i);
            } catch (TransientCommandException e) {
                last = e;
                logger.warn("{} failed (attempt {}/{}): {}", operation, i, maxAttempts, e.getMessage());
                if (i < maxAttempts) {
                    pause(operation);
                }
            }
        }
        assert last != null;
        logger.error("{} failed {} times, giving up", operation, maxAttempts);
        throw new RetryBudgetExhaustedException(operation, maxAttempts, last);
    }

    private void pause(String operation) throws FatalConversionException {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalConversionException("Interrupted while waiting to retry " + operation, e);
        }
    }
}

package org.example.aipacs.service.impl;

import org.example.aipacs.config.PipelineProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with upward jitter. Failure {@code n} (1-based) waits
 * {@code base * 2^(n-1)} plus up to half of that again, capped at {@code maxDelay}; the jitter window
 * of one step never overlaps the next, so uncapped delays strictly increase.
 */
public class BackoffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    public static BackoffPolicy from(PipelineProperties.Retry retry) {
        return new BackoffPolicy(retry.getBaseDelay(), retry.getMaxDelay(), retry.getMaxAttempts(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param failures failures recorded so far, including the one just observed
     */
    public boolean exhausted(int failures) {
        return failures >= maxAttempts;
    }

    public Duration delayFor(int failures) {
        int n = Math.max(1, failures);
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        long exp = n > 31 ? Long.MAX_VALUE : base << (n - 1);
        if (exp < 0 || exp >= cap) {
            return maxDelay;
        }
        double r = Math.min(Math.max(random.getAsDouble(), 0.0), 0.999);
        long jitter = (long) (exp * 0.5 * r);
        return Duration.ofMillis(Math.min(cap, exp + jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}

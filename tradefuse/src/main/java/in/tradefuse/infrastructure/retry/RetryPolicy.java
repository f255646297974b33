package in.tradefuse.infrastructure.retry;

import in.tradefuse.config.ExecutionConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Retry policy with exponential backoff and jitter for external calls.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum attempt limit (first call included)
 * - Maximum backoff duration (cap)
 * - Optional proportional jitter
 *
 * One instance tracks one logical call; create a fresh policy per call.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(2))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .jitter(0.2)
 *     .build();
 *
 * while (policy.shouldRetry()) {
 *     try {
 *         return fetch();
 *     } catch (Exception e) {
 *         policy.recordFailure();
 *         if (policy.shouldRetry()) {
 *             sleeper.sleep(policy.getNextDelay());
 *         }
 *     }
 * }
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final double jitter;
    private final Random random;

    private int failureCount = 0;
    private Instant lastFailureTime;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
                        int maxAttempts, double jitter, Random random) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Check if another attempt may be made.
     */
    public synchronized boolean shouldRetry() {
        return failureCount < maxAttempts;
    }

    /**
     * Delay before the next attempt: initialDelay * multiplier^(failures - 1), capped at maxDelay,
     * then spread by +/- jitter. Zero before the first failure.
     */
    public synchronized Duration getNextDelay() {
        if (failureCount == 0) {
            return Duration.ZERO;
        }
        double base = initialDelay.toMillis() * Math.pow(multiplier, failureCount - 1);
        long capped = (long) Math.min(base, maxDelay.toMillis());
        if (jitter <= 0) {
            return Duration.ofMillis(capped);
        }
        double spread = 1.0 - jitter + (2.0 * jitter * random.nextDouble());
        return Duration.ofMillis(Math.max(0L, Math.round(capped * spread)));
    }

    /**
     * Record a failed attempt.
     */
    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = Instant.now();
    }

    /**
     * Check if all attempts are used up.
     */
    public synchronized boolean isExhausted() {
        return failureCount >= maxAttempts;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for read-only calls to the exchange, model and store.
     */
    public static RetryPolicy forExternalRead() {
        return builder()
            .initialDelay(Duration.ofMillis(200))
            .maxDelay(Duration.ofSeconds(2))
            .multiplier(2.0)
            .maxAttempts(3)
            .jitter(0.2)
            .build();
    }

    /**
     * Policy for polling fill data after an order was placed.
     */
    public static RetryPolicy forFillPolling(ExecutionConfig config) {
        long initial = config.fillRetryInitialDelayMs();
        long max = (long) (initial * Math.pow(config.fillRetryMultiplier(), Math.max(0, config.fillRetryAttempts() - 1)));
        return builder()
            .initialDelay(Duration.ofMillis(initial))
            .maxDelay(Duration.ofMillis(Math.max(initial, max)))
            .multiplier(config.fillRetryMultiplier())
            .maxAttempts(config.fillRetryAttempts())
            .jitter(0.1)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private int maxAttempts = 3;
        private double jitter = 0.0;
        private Random random = new Random();

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder jitter(double jitter) {
            if (jitter < 0.0 || jitter >= 1.0) {
                throw new IllegalArgumentException("Jitter must be in [0, 1)");
            }
            this.jitter = jitter;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts, jitter, random);
        }
    }
}

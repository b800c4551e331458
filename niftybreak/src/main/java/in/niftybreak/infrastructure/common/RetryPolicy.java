package in.niftybreak.infrastructure.common;

import java.time.Duration;

/**
 * Retry policy with exponential backoff for collaborator calls
 * (feed reconnects, order placement, historical fetches).
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.forOrders();
 * while (policy.shouldRetry()) {
 *     try {
 *         send();
 *         policy.recordSuccess();
 *         break;
 *     } catch (IOException e) {
 *         policy.recordFailure();
 *         sleeper.sleep(policy.getNextDelay());
 *     }
 * }
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private boolean exhausted = false;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true if another attempt may be made
     */
    public synchronized boolean shouldRetry() {
        return !exhausted && attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt. The delay returned by getNextDelay() after
     * the n-th failure is initialDelay * multiplier^(n-1), capped at maxDelay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        if (attemptCount > 1) {
            long next = (long) (currentDelay.toMillis() * multiplier);
            currentDelay = Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
        }
        if (attemptCount >= maxAttempts) {
            exhausted = true;
        }
    }

    /**
     * Record a success. Resets counters.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        exhausted = false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Market feed reconnects: 1s doubling to 60s, 10 attempts.
     */
    public static RetryPolicy forFeed() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(60))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();
    }

    /**
     * Order placement: 3 attempts, waits of 1s, 2s between them.
     */
    public static RetryPolicy forOrders() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(8))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Historical fetches: 3 attempts, 2s apart.
     */
    public static RetryPolicy forHistory() {
        return builder()
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(2))
            .multiplier(1.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("Initial delay must not be negative");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("Max delay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be >= 1.0");
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

        public RetryPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("Max delay must be >= initial delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}

package com.workflow.core.model;

import java.time.Duration;

/**
 * Per-step failure policy.
 * Immutable and reusable across steps.
 *
 * Invariants:
 * - maxRetries >= 0
 * - retryDelaySeconds >= 0
 * - backoffMultiplier >= 1.0
 * - maxRetryDelaySeconds >= retryDelaySeconds
 */
public record ErrorHandlingPolicy(
    int maxRetries,
    long retryDelaySeconds,
    double backoffMultiplier,
    long maxRetryDelaySeconds,
    OnError onError
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_SECONDS = 5;
    public static final long DEFAULT_MAX_RETRY_DELAY_SECONDS = 3600;

    public ErrorHandlingPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelaySeconds < 0) {
            throw new IllegalArgumentException("retryDelaySeconds must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxRetryDelaySeconds < retryDelaySeconds) {
            maxRetryDelaySeconds = retryDelaySeconds;
        }
        if (onError == null) {
            onError = OnError.STOP;
        }
    }

    /**
     * Default policy: 3 attempts, fixed 5s delay, stop on exhaustion.
     */
    public static ErrorHandlingPolicy defaultPolicy() {
        return new ErrorHandlingPolicy(
            DEFAULT_MAX_RETRIES,
            DEFAULT_RETRY_DELAY_SECONDS,
            1.0,
            DEFAULT_MAX_RETRY_DELAY_SECONDS,
            OnError.STOP
        );
    }

    /**
     * Policy of a step that declares none. Notifications are best-effort, so they
     * default to a single attempt and continue; every other kind gets {@link #defaultPolicy()}.
     */
    public static ErrorHandlingPolicy defaultFor(StepKind kind) {
        if (kind == StepKind.NOTIFICATION) {
            return of(0, 0, OnError.CONTINUE);
        }
        return defaultPolicy();
    }

    /**
     * Fixed-delay policy with the given bound.
     */
    public static ErrorHandlingPolicy of(int maxRetries, long retryDelaySeconds, OnError onError) {
        return new ErrorHandlingPolicy(
            maxRetries, retryDelaySeconds, 1.0, DEFAULT_MAX_RETRY_DELAY_SECONDS, onError);
    }

    /**
     * Delay to wait before re-dispatching after the given failure.
     *
     * @param failureCount 1-indexed count of consecutive failures of the step
     * @return delay before the next attempt
     */
    public Duration computeRetryDelay(int failureCount) {
        if (failureCount < 1) {
            throw new IllegalArgumentException("Failure count must be >= 1");
        }

        // retryDelay * (multiplier ^ (failures - 1)), capped
        double delaySeconds = retryDelaySeconds * Math.pow(backoffMultiplier, failureCount - 1);
        double cappedSeconds = Math.min(delaySeconds, maxRetryDelaySeconds);

        return Duration.ofMillis((long) (cappedSeconds * 1000));
    }

    /**
     * Check if another attempt is allowed after the given number of failures.
     *
     * @param failureCount failures recorded so far (execution.retryCount)
     */
    public boolean hasMoreAttempts(int failureCount) {
        return onError != OnError.SKIP && failureCount < maxRetries;
    }

    /**
     * Builder for ErrorHandlingPolicy.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryDelaySeconds = DEFAULT_RETRY_DELAY_SECONDS;
        private double backoffMultiplier = 1.0;
        private long maxRetryDelaySeconds = DEFAULT_MAX_RETRY_DELAY_SECONDS;
        private OnError onError = OnError.STOP;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelaySeconds(long retryDelaySeconds) {
            this.retryDelaySeconds = retryDelaySeconds;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxRetryDelaySeconds(long maxRetryDelaySeconds) {
            this.maxRetryDelaySeconds = maxRetryDelaySeconds;
            return this;
        }

        public Builder onError(OnError onError) {
            this.onError = onError;
            return this;
        }

        public ErrorHandlingPolicy build() {
            return new ErrorHandlingPolicy(
                maxRetries, retryDelaySeconds, backoffMultiplier,
                maxRetryDelaySeconds, onError
            );
        }
    }
}

package com.alexberriman.domauditor.service.concurrency;

/**
 * Computes the wait between a failed attempt and the next one.
 *
 * <p>Implementations must be pure functions of their arguments and strictly increasing in
 * {@code attempt} for a positive base delay.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param baseDelayMs delay seed in milliseconds (non-negative)
     * @param attempt     zero-based index of the attempt that just failed
     * @return milliseconds to wait before the next attempt
     */
    long delayMillis(long baseDelayMs, int attempt);

    /**
     * Doubling backoff: {@code baseDelayMs * 2^attempt}, saturating at {@link Long#MAX_VALUE}.
     * No jitter is applied.
     */
    static BackoffPolicy exponential() {
        return (baseDelayMs, attempt) -> {
            if (baseDelayMs <= 0) {
                return 0L;
            }
            if (attempt >= Long.numberOfLeadingZeros(baseDelayMs)) {
                return Long.MAX_VALUE;
            }
            return baseDelayMs << attempt;
        };
    }
}

package com.alexberriman.domauditor.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Concurrency and retry settings for audit batches.
 *
 * <p>Properties:
 * <ul>
 *   <li>audit.concurrency.max-threads - Maximum pages audited at once (default: 3, range 1-10)</li>
 *   <li>audit.concurrency.max-retries - Retries after a failed attempt (default: 3)</li>
 *   <li>audit.concurrency.retry-delay-ms - Backoff seed in ms, doubled per attempt (default: 1000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "audit.concurrency")
@Validated
public class ConcurrencyProperties {

    /** Maximum number of tasks executing at once. */
    @Min(value = 1, message = "Max threads must be between 1 and 10")
    @Max(value = 10, message = "Max threads must be between 1 and 10")
    private int maxThreads = 3;

    /** Retries after the first failed attempt; 0 disables retry. */
    @Min(value = 0, message = "Max retries must not be negative")
    private int maxRetries = 3;

    /**
     * Base backoff delay in milliseconds. Attempt k (0-based) waits retryDelayMs * 2^k.
     * Set to 0 to retry immediately.
     */
    @Min(value = 0, message = "Retry delay must not be negative")
    private long retryDelayMs = 1000;

    public int getMaxThreads() {
        return maxThreads;
    }

    public void setMaxThreads(int maxThreads) {
        this.maxThreads = maxThreads;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }
}

package com.alexberriman.domauditor.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for tasks run through the concurrency core.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Task latency (permit held to completion)</li>
 *   <li>Success/failure counts, failures tagged by reason</li>
 *   <li>Retry attempts scheduled after a failure</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ConcurrencyMetrics {

    private static final String METRIC_PREFIX = "domauditor.task";

    private final MeterRegistry registry;

    public ConcurrencyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a task ran while holding a permit.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time a task spent executing while holding a permit")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of tasks that produced a value")
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure reason (rejected, task_failed, retries_exhausted)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of tasks that did not produce a value")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Increments the retry counter each time a failed attempt is followed by another one.
     */
    public void incrementRetry() {
        Counter.builder(METRIC_PREFIX + ".retry")
                .description("Number of retry attempts scheduled after a failure")
                .register(registry)
                .increment();
    }
}

package com.alexberriman.domauditor.service.concurrency;

import com.alexberriman.domauditor.config.properties.ConcurrencyProperties;
import com.alexberriman.domauditor.service.metrics.ConcurrencyMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Creates a fresh {@link ConcurrencyController} or {@link TaskQueue} per audit batch, wired
 * with the configured limits, the {@code auditExecutor} pool and Micrometer metrics.
 *
 * <p>Controllers are single-use, so this factory is the Spring-managed entry point rather than
 * a controller bean.
 */
@Service
public class ConcurrencyControllerFactory {
    private static final Logger LOG = LogManager.getLogger(ConcurrencyControllerFactory.class);

    private final ConcurrencyProperties properties;
    private final Executor executor;
    private final ConcurrencyMetrics metrics;
    private final Delayer delayer;

    public ConcurrencyControllerFactory(ConcurrencyProperties properties,
                                        @Qualifier("auditExecutor") Executor executor,
                                        ConcurrencyMetrics metrics,
                                        Delayer delayer) {
        this.properties = Objects.requireNonNull(properties);
        this.executor = Objects.requireNonNull(executor);
        this.metrics = metrics;
        this.delayer = Objects.requireNonNull(delayer);
    }

    /**
     * @return a controller limited to {@code audit.concurrency.max-threads}
     */
    public <T> ConcurrencyController<T> create() {
        return create(properties.getMaxThreads());
    }

    /**
     * @param concurrencyLimit maximum number of tasks executing at once
     * @return a new controller sharing this factory's executor, metrics and retry defaults
     */
    public <T> ConcurrencyController<T> create(int concurrencyLimit) {
        LOG.debug("Creating concurrency controller: limit={}, maxRetries={}, retryDelayMs={}",
                concurrencyLimit, properties.getMaxRetries(), properties.getRetryDelayMs());
        return ConcurrencyController.builder(concurrencyLimit)
                .executor(executor)
                .delayer(delayer)
                .metrics(metrics)
                .defaultMaxRetries(properties.getMaxRetries())
                .defaultRetryDelayMs(properties.getRetryDelayMs())
                .build();
    }

    public <T> TaskQueue<T> createQueue() {
        return new TaskQueue<>(this.<T>create());
    }
}

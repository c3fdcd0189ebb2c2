package com.alexberriman.domauditor.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes audit executor pool metrics via Micrometer:
 * <ul>
 *   <li>audit.pool.size - Current number of threads in the pool</li>
 *   <li>audit.pool.active - Number of actively executing tasks</li>
 *   <li>audit.pool.queued - Number of tasks waiting in the executor queue</li>
 *   <li>audit.pool.completed - Cumulative count of completed tasks</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> auditExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("auditExecutor") ObjectProvider<ThreadPoolTaskExecutor> auditExecutorProvider) {
        this.auditExecutorProvider = auditExecutorProvider;
    }

    /**
     * Binds audit executor thread pool metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers the gauges
     */
    @Bean
    public MeterBinder auditExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = auditExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("audit.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the audit pool")
                    .register(registry);

            Gauge.builder("audit.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively executing audit tasks")
                    .register(registry);

            Gauge.builder("audit.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of audit tasks waiting in the executor queue")
                    .register(registry);

            Gauge.builder("audit.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed audit tasks")
                    .register(registry);

            LOG.info("Audit thread pool metrics registered: audit.pool.* available via /actuator/metrics");
        };
    }
}

package com.alexberriman.domauditor.config;

import com.alexberriman.domauditor.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool used by the concurrency core.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the executor for blocking audit tasks and for resuming tasks that waited for
     * a permit.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.audit.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - handles the default concurrency limit with headroom</li>
     *   <li>Max pool: default 8 - handles burst traffic</li>
     *   <li>Queue: default 50 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link #callerRunsUnlessShutdown()}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast. Once the pool is shut down the task is
     * refused with {@link RejectedExecutionException} so the submitter can fail it.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread so audit correlation ids survive the hop.
     *
     * @return Configured executor for audit tasks
     */
    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor() {
        ThreadPoolProperties.AuditPoolProperties auditProps = threadPoolProperties.getAudit();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(auditProps.getCorePoolSize());
        executor.setMaxPoolSize(auditProps.getMaxPoolSize());
        executor.setQueueCapacity(auditProps.getQueueCapacity());
        executor.setThreadNamePrefix(auditProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(auditProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(callerRunsUnlessShutdown());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Like {@link ThreadPoolExecutor.CallerRunsPolicy}, but throws instead of silently
     * discarding the task after shutdown.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (runnable, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("Audit executor has been shut down");
            }
            runnable.run();
        };
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}

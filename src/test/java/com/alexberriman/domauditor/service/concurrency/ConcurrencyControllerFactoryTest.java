package com.alexberriman.domauditor.service.concurrency;

import com.alexberriman.domauditor.config.properties.ConcurrencyProperties;
import com.alexberriman.domauditor.service.metrics.ConcurrencyMetrics;
import com.alexberriman.domauditor.testutil.RecordingDelayer;
import com.alexberriman.domauditor.testutil.SyncExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyControllerFactoryTest {

    private MeterRegistry registry;
    private RecordingDelayer delayer;
    private ConcurrencyControllerFactory factory;

    @BeforeEach
    void setUp() {
        ConcurrencyProperties properties = new ConcurrencyProperties();
        properties.setMaxThreads(2);
        properties.setMaxRetries(1);
        properties.setRetryDelayMs(25);
        registry = new SimpleMeterRegistry();
        delayer = new RecordingDelayer();
        factory = new ConcurrencyControllerFactory(properties, new SyncExecutor(),
                new ConcurrencyMetrics(registry), delayer);
    }

    @Test
    void createsControllerWithConfiguredLimit() {
        ConcurrencyController<String> controller = factory.create();

        assertThat(controller.getStats().availablePermits()).isEqualTo(2);
        assertThat(factory.<String>create(5).getStats().availablePermits()).isEqualTo(5);
    }

    @Test
    void appliesConfiguredRetryDefaults() {
        ConcurrencyController<String> controller = factory.create();
        AtomicInteger attempts = new AtomicInteger();

        TaskResult<String> result = controller.executeTaskWithRetry("page", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new RuntimeException("timeout"));
        }).join();

        assertThat(result.getErrorMessage()).isEqualTo("Task page failed after 2 attempts");
        assertThat(attempts).hasValue(2);
        assertThat(delayer.delays()).containsExactly(25L);
        assertThat(registry.find("domauditor.task.retry").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("domauditor.task.failure").tag("reason", "retries_exhausted")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void createsIndependentControllers() {
        ConcurrencyController<String> first = factory.create();
        ConcurrencyController<String> second = factory.create();

        first.stop();

        assertThat(first.isStopped()).isTrue();
        assertThat(second.isStopped()).isFalse();
    }

    @Test
    void createsQueueOverFreshController() {
        TaskQueue<String> queue = factory.createQueue();

        TaskResult<String> result = queue.enqueue("url-1",
                () -> CompletableFuture.completedFuture("audited")).join();

        assertThat(result.getValue()).isEqualTo("audited");
        assertThat(queue.getStats().controllerStats().availablePermits()).isEqualTo(2);
        assertThat(registry.find("domauditor.task.success").counter().count()).isEqualTo(1.0);
    }
}

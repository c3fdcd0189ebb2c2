package com.alexberriman.domauditor.service.concurrency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class TaskQueueTest {

    private TaskQueue<String> queue;

    @BeforeEach
    void setUp() {
        queue = new TaskQueue<>(2);
    }

    @Test
    void processesQueuedTasks() {
        CompletableFuture<TaskResult<String>> first =
                queue.enqueue("task1", () -> CompletableFuture.completedFuture("result1"));
        CompletableFuture<TaskResult<String>> second =
                queue.enqueue("task2", () -> CompletableFuture.completedFuture("result2"));

        assertThat(first.join().getValue()).isEqualTo("result1");
        assertThat(second.join().getValue()).isEqualTo("result2");
    }

    @Test
    void reportsTaskFailures() {
        TaskResult<String> result = queue.enqueue("failing",
                () -> CompletableFuture.failedFuture(new RuntimeException("Queue task failed"))).join();

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getErrorMessage()).contains("Task failing failed");
    }

    @Test
    void stopIsReflectedInStatsAndRejectsNewWork() {
        queue.stop();

        assertThat(queue.getStats().controllerStats().isStopped()).isTrue();
        TaskResult<String> result = queue.enqueue("late",
                () -> CompletableFuture.completedFuture("never")).join();
        assertThat(result.getErrorMessage()).isEqualTo("Concurrency controller has been stopped");
    }

    @Test
    void queueLengthCountsSubmissionsWaitingForPermit() {
        CompletableFuture<String> gate = new CompletableFuture<>();
        List<CompletableFuture<TaskResult<String>>> results = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            results.add(queue.enqueue("task" + i, () -> gate));
        }

        QueueStats stats = queue.getStats();
        assertThat(stats.queueLength()).isEqualTo(2);
        assertThat(stats.controllerStats().waitingTasks()).isEqualTo(2);
        assertThat(stats.controllerStats().runningTasks()).isEqualTo(2);
        assertThat(stats.controllerStats().availablePermits()).isZero();

        gate.complete("done");
        queue.awaitCompletion().join();

        assertThat(results).allMatch(f -> f.join().isSuccess());
        assertThat(queue.getStats().queueLength()).isZero();
    }

    @Test
    void wrapsExistingController() {
        ConcurrencyController<String> controller = new ConcurrencyController<>(1);
        TaskQueue<String> wrapping = new TaskQueue<>(controller);

        wrapping.stop();

        assertThat(controller.isStopped()).isTrue();
    }
}

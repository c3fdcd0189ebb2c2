package com.alexberriman.domauditor.service.concurrency;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Queue-shaped submission API over a {@link ConcurrencyController}.
 *
 * <p>There is no explicit buffer: submissions beyond the concurrency limit wait as semaphore
 * waiters, so {@link QueueStats#queueLength()} is the controller's waiter count.
 *
 * @param <T> value type produced by the tasks
 */
public class TaskQueue<T> {

    private final ConcurrencyController<T> controller;

    public TaskQueue(int concurrencyLimit) {
        this(new ConcurrencyController<>(concurrencyLimit));
    }

    public TaskQueue(ConcurrencyController<T> controller) {
        this.controller = Objects.requireNonNull(controller, "controller");
    }

    /**
     * Submits a task; equivalent to {@link ConcurrencyController#executeTask}.
     */
    public CompletableFuture<TaskResult<T>> enqueue(String taskId, AsyncTask<T> task) {
        return controller.executeTask(taskId, task);
    }

    public void stop() {
        controller.stop();
    }

    public QueueStats getStats() {
        ControllerStats stats = controller.getStats();
        return new QueueStats(stats.waitingTasks(), stats);
    }

    public CompletableFuture<Void> awaitCompletion() {
        return controller.awaitCompletion();
    }
}

package com.alexberriman.domauditor.service.concurrency;

import com.alexberriman.domauditor.exception.ConcurrencyException;
import com.alexberriman.domauditor.service.metrics.ConcurrencyMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs asynchronous units of work under a fixed concurrency ceiling.
 *
 * <p>Every submission acquires a permit from an owned {@link FifoSemaphore}, runs, and releases
 * the permit on both the success and the failure path. Submissions beyond the ceiling wait in
 * FIFO order. Key features:
 * <ul>
 *   <li><b>Error Isolation:</b> Task failures are returned as {@link TaskResult#failure}
 *       values; the returned futures do not complete exceptionally for them</li>
 *   <li><b>Batches:</b> {@link #executeTasks(List)} runs independent tasks concurrently and
 *       reports per-task results in input order</li>
 *   <li><b>Retry:</b> {@link #executeTaskWithRetry} re-runs a failing task with exponential
 *       backoff, each attempt a full acquire/run/release cycle</li>
 *   <li><b>Shutdown:</b> {@link #stop()} rejects all later submissions; running tasks finish
 *       normally</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> A task admitted immediately starts on the submitting thread. A task
 * that had to wait is dispatched to the configured executor once its permit is handed over.
 * Dispatches are queued and drained in a loop by whichever thread is already draining, so an
 * executor that runs jobs on the caller ({@code CallerRunsPolicy}, a synchronous executor)
 * resumes a long chain of waiters iteratively instead of recursively. If the executor refuses
 * the dispatch, the permit is released and the task fails. Blocking work should be submitted
 * through {@link #executeBlockingTask(String, Callable)}, which runs it on the executor.
 *
 * <p>A controller lives for one audit batch: create it, submit work, {@link #stop()} it and
 * wait for {@link #awaitCompletion()}. It cannot be restarted.
 *
 * @param <T> value type produced by the tasks
 * @since 1.0
 */
public class ConcurrencyController<T> {
    private static final Logger LOG = LogManager.getLogger(ConcurrencyController.class);

    static final String STOPPED_MESSAGE = "Concurrency controller has been stopped";
    static final String STOPPED_WHILE_WAITING_MESSAGE =
            "Concurrency controller was stopped during task execution";
    static final String BATCH_FAILED_MESSAGE = "Failed to execute tasks concurrently";

    /** MDC key holding the id of the task running on the current thread. */
    public static final String TASK_ID_KEY = "taskId";

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 1000L;

    private final FifoSemaphore semaphore;
    private final Executor executor;
    private final BackoffPolicy backoffPolicy;
    private final Delayer delayer;
    private final ConcurrencyMetrics metrics;
    private final int defaultMaxRetries;
    private final long defaultRetryDelayMs;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final Queue<Runnable> handoffs = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    /**
     * Creates a controller with default executor, backoff and retry settings and no metrics.
     *
     * @param concurrencyLimit maximum number of tasks executing at once
     * @throws IllegalArgumentException if concurrencyLimit is not positive
     */
    public ConcurrencyController(int concurrencyLimit) {
        this(builder(concurrencyLimit));
    }

    private ConcurrencyController(Builder builder) {
        this.semaphore = new FifoSemaphore(builder.concurrencyLimit);
        this.executor = builder.executor;
        this.backoffPolicy = builder.backoffPolicy;
        this.delayer = builder.delayer;
        this.metrics = builder.metrics;
        this.defaultMaxRetries = builder.defaultMaxRetries;
        this.defaultRetryDelayMs = builder.defaultRetryDelayMs;
    }

    public static Builder builder(int concurrencyLimit) {
        return new Builder(concurrencyLimit);
    }

    /**
     * Runs one task under the concurrency limit.
     *
     * <p>If the controller is stopped the task is never invoked and the result is a failure
     * with message {@value #STOPPED_MESSAGE}. A task that fails (exceptional stage, exception
     * thrown from {@link AsyncTask#start()}, or a {@code null} stage) yields a failure with
     * message {@code "Task <id> failed"} and the task's exception as cause.
     *
     * @param taskId diagnostic id of the task
     * @param task   work to run
     * @return future of the task's result; never completes exceptionally for task failures
     * @throws NullPointerException if taskId or task is null
     */
    public CompletableFuture<TaskResult<T>> executeTask(String taskId, AsyncTask<T> task) {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(task, "task");

        if (stopped.get()) {
            LOG.debug("Rejected task {}: controller stopped", taskId);
            return CompletableFuture.completedFuture(reject(taskId, STOPPED_MESSAGE));
        }

        CompletableFuture<Void> permit = semaphore.acquire();
        CompletableFuture<TaskResult<T>> result;
        if (permit.isDone()) {
            result = runWithPermit(taskId, task);
        } else {
            LOG.debug("Task {} waiting for a permit ({} already waiting)", taskId,
                    semaphore.waitingCount() - 1);
            CompletableFuture<TaskResult<T>> pending = new CompletableFuture<>();
            permit.thenRun(() -> handOff(() -> dispatch(taskId, task, pending)));
            result = pending;
        }
        track(result);
        return result;
    }

    /**
     * Runs a blocking callable under the concurrency limit on this controller's executor.
     *
     * <p>Same contract as {@link #executeTask(String, AsyncTask)}. The task id is available in
     * the Log4j2 {@link ThreadContext} under {@value #TASK_ID_KEY} while the callable runs.
     *
     * @param taskId   diagnostic id of the task
     * @param callable work to run
     * @return future of the task's result
     */
    public CompletableFuture<TaskResult<T>> executeBlockingTask(String taskId, Callable<T> callable) {
        Objects.requireNonNull(callable, "callable");
        return executeTask(taskId, () -> {
            CompletableFuture<T> future = new CompletableFuture<>();
            executor.execute(() -> {
                String previous = ThreadContext.get(TASK_ID_KEY);
                ThreadContext.put(TASK_ID_KEY, taskId);
                try {
                    future.complete(callable.call());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                } finally {
                    restoreTaskId(previous);
                }
            });
            return future;
        });
    }

    /**
     * Runs every entry concurrently, each independently subject to the concurrency limit.
     *
     * @param entries tasks to run
     * @return a success wrapping the per-entry results in input order; individual failures do
     *         not fail the batch
     */
    public CompletableFuture<TaskResult<List<TaskResult<T>>>> executeTasks(List<TaskEntry<T>> entries) {
        Objects.requireNonNull(entries, "entries");

        List<CompletableFuture<TaskResult<T>>> futures = new ArrayList<>(entries.size());
        try {
            for (TaskEntry<T> entry : entries) {
                futures.add(executeTask(entry.id(), entry.task()));
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to schedule batch of {} tasks", entries.size(), e);
            return CompletableFuture.completedFuture(TaskResult.<List<TaskResult<T>>>failure(
                    new ConcurrencyException(BATCH_FAILED_MESSAGE, null,
                            ConcurrencyException.Kind.BATCH_FAILED, e)));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        LOG.error("Batch of {} tasks failed", futures.size(), cause);
                        return TaskResult.<List<TaskResult<T>>>failure(new ConcurrencyException(
                                BATCH_FAILED_MESSAGE, null,
                                ConcurrencyException.Kind.BATCH_FAILED, cause));
                    }
                    List<TaskResult<T>> results = new ArrayList<>(futures.size());
                    for (CompletableFuture<TaskResult<T>> future : futures) {
                        results.add(future.join());
                    }
                    return TaskResult.success(List.copyOf(results));
                });
    }

    /**
     * Runs a task with the configured default retry count and base delay.
     *
     * @see #executeTaskWithRetry(String, AsyncTask, int, long)
     */
    public CompletableFuture<TaskResult<T>> executeTaskWithRetry(String taskId, AsyncTask<T> task) {
        return executeTaskWithRetry(taskId, task, defaultMaxRetries, defaultRetryDelayMs);
    }

    /**
     * Runs a task up to {@code maxRetries + 1} times, waiting with exponential backoff between
     * a failed attempt and the next one.
     *
     * <p>Each attempt is a full {@link #executeTask} cycle, so the permit is released while
     * waiting. The first success is returned immediately. If the controller is stopped the
     * loop ends with {@value #STOPPED_MESSAGE}, also for an attempt that was waiting for a
     * permit when {@link #stop()} was called. When every attempt fails the message is
     * {@code "Task <id> failed after <n> attempts"} and the cause is the last attempt's cause.
     *
     * @param taskId      diagnostic id of the task
     * @param task        work to run
     * @param maxRetries  retries after the first attempt
     * @param baseDelayMs backoff seed in milliseconds
     * @return future of the final result
     * @throws IllegalArgumentException if maxRetries or baseDelayMs is negative
     */
    public CompletableFuture<TaskResult<T>> executeTaskWithRetry(String taskId,
                                                                  AsyncTask<T> task,
                                                                  int maxRetries,
                                                                  long baseDelayMs) {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(task, "task");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got: " + maxRetries);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative, got: " + baseDelayMs);
        }
        CompletableFuture<TaskResult<T>> result = attempt(taskId, task, 0, maxRetries, baseDelayMs);
        track(result);
        return result;
    }

    /**
     * Stops admitting tasks. Idempotent; tasks already holding a permit are not interrupted.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            LOG.info("Concurrency controller stopped: {} running, {} waiting",
                    runningTasks(), semaphore.waitingCount());
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * @return snapshot of the stopped flag and the permit counters
     */
    public ControllerStats getStats() {
        int available = semaphore.availablePermits();
        return new ControllerStats(
                stopped.get(),
                available,
                semaphore.waitingCount(),
                semaphore.capacity() - available
        );
    }

    /**
     * Returns a future that completes once every task submitted so far has produced its result.
     * Usually called after {@link #stop()} to drain the controller.
     *
     * @return future completing when the in-flight tasks have settled
     */
    public CompletableFuture<Void> awaitCompletion() {
        return CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0]));
    }

    private CompletableFuture<TaskResult<T>> attempt(String taskId, AsyncTask<T> task, int attempt,
                                                    int maxRetries, long baseDelayMs) {
        return executeTask(taskId, task).thenCompose(result -> {
            if (result.isSuccess()) {
                return CompletableFuture.completedFuture(result);
            }
            if (result.getError().getKind() == ConcurrencyException.Kind.REJECTED) {
                return CompletableFuture.completedFuture(TaskResult.<T>failure(new ConcurrencyException(
                        STOPPED_MESSAGE, taskId, ConcurrencyException.Kind.REJECTED)));
            }
            if (attempt >= maxRetries) {
                long attempts = (long) maxRetries + 1;
                LOG.warn("Task {} failed after {} attempts", taskId, attempts);
                recordFailure("retries_exhausted");
                return CompletableFuture.completedFuture(TaskResult.<T>failure(new ConcurrencyException(
                        "Task " + taskId + " failed after " + attempts + " attempts",
                        taskId, ConcurrencyException.Kind.RETRIES_EXHAUSTED,
                        result.getError().getCause())));
            }
            long delayMs = backoffPolicy.delayMillis(baseDelayMs, attempt);
            LOG.warn("Task {} attempt {}/{} failed, retrying in {} ms",
                    taskId, attempt + 1, maxRetries + 1L, delayMs);
            if (metrics != null) {
                metrics.incrementRetry();
            }
            return delayer.delay(delayMs)
                    .thenCompose(ignored -> attempt(taskId, task, attempt + 1, maxRetries, baseDelayMs));
        });
    }

    /**
     * Queues a handoff and drains the queue unless another frame or thread is already draining.
     * The re-check after clearing the flag picks up handoffs queued during the race window.
     */
    private void handOff(Runnable handoff) {
        handoffs.add(handoff);
        while (!handoffs.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                Runnable next;
                while ((next = handoffs.poll()) != null) {
                    next.run();
                }
            } finally {
                draining.set(false);
            }
        }
    }

    /**
     * Starts a task whose permit was handed over while it waited. Runs inside the handoff loop.
     */
    private void dispatch(String taskId, AsyncTask<T> task, CompletableFuture<TaskResult<T>> result) {
        try {
            executor.execute(() -> runWithPermit(taskId, task).whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(value);
                }
            }));
        } catch (RejectedExecutionException e) {
            semaphore.release();
            LOG.warn("Task {} could not be dispatched: {}", taskId, e.getMessage());
            recordFailure("task_failed");
            result.complete(TaskResult.failure(new ConcurrencyException("Task " + taskId + " failed",
                    taskId, ConcurrencyException.Kind.TASK_FAILED, e)));
        }
    }

    private CompletableFuture<TaskResult<T>> runWithPermit(String taskId, AsyncTask<T> task) {
        if (stopped.get()) {
            semaphore.release();
            LOG.debug("Task {} admitted after stop; not started", taskId);
            return CompletableFuture.completedFuture(reject(taskId, STOPPED_WHILE_WAITING_MESSAGE));
        }

        long startNanos = System.nanoTime();
        CompletionStage<T> stage;
        String previous = ThreadContext.get(TASK_ID_KEY);
        ThreadContext.put(TASK_ID_KEY, taskId);
        try {
            stage = Objects.requireNonNull(task.start(), "Task returned a null completion stage");
        } catch (Exception e) {
            stage = CompletableFuture.failedFuture(e);
        } catch (Error e) {
            semaphore.release();
            throw e;
        } finally {
            restoreTaskId(previous);
        }

        return stage.handle((value, error) -> {
            semaphore.release();
            if (metrics != null) {
                metrics.recordLatency(System.nanoTime() - startNanos);
            }
            if (error == null) {
                if (metrics != null) {
                    metrics.incrementSuccess();
                }
                return TaskResult.success(value);
            }
            Throwable cause = unwrap(error);
            LOG.warn("Task {} failed: {}", taskId, cause.toString());
            recordFailure("task_failed");
            return TaskResult.<T>failure(new ConcurrencyException("Task " + taskId + " failed",
                    taskId, ConcurrencyException.Kind.TASK_FAILED, cause));
        }).toCompletableFuture();
    }

    private TaskResult<T> reject(String taskId, String message) {
        recordFailure("rejected");
        return TaskResult.failure(new ConcurrencyException(message, taskId,
                ConcurrencyException.Kind.REJECTED));
    }

    private void recordFailure(String reason) {
        if (metrics != null) {
            metrics.incrementFailure(reason);
        }
    }

    private void track(CompletableFuture<TaskResult<T>> result) {
        inFlight.add(result);
        result.whenComplete((r, e) -> inFlight.remove(result));
    }

    private int runningTasks() {
        return semaphore.capacity() - semaphore.availablePermits();
    }

    private static void restoreTaskId(String previous) {
        if (previous == null) {
            ThreadContext.remove(TASK_ID_KEY);
        } else {
            ThreadContext.put(TASK_ID_KEY, previous);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Builder for {@link ConcurrencyController}; unset values fall back to defaults.
     */
    public static final class Builder {
        private final int concurrencyLimit;
        private Executor executor = ForkJoinPool.commonPool();
        private BackoffPolicy backoffPolicy = BackoffPolicy.exponential();
        private Delayer delayer = Delayer.system();
        private ConcurrencyMetrics metrics;
        private int defaultMaxRetries = DEFAULT_MAX_RETRIES;
        private long defaultRetryDelayMs = DEFAULT_RETRY_DELAY_MS;

        private Builder(int concurrencyLimit) {
            if (concurrencyLimit <= 0) {
                throw new IllegalArgumentException(
                        "Concurrency limit must be positive, got: " + concurrencyLimit);
            }
            this.concurrencyLimit = concurrencyLimit;
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
            return this;
        }

        public Builder delayer(Delayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer");
            return this;
        }

        /**
         * @param metrics metrics sink (nullable; no metrics are recorded when null)
         */
        public Builder metrics(ConcurrencyMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder defaultMaxRetries(int defaultMaxRetries) {
            if (defaultMaxRetries < 0) {
                throw new IllegalArgumentException("defaultMaxRetries must not be negative");
            }
            this.defaultMaxRetries = defaultMaxRetries;
            return this;
        }

        public Builder defaultRetryDelayMs(long defaultRetryDelayMs) {
            if (defaultRetryDelayMs < 0) {
                throw new IllegalArgumentException("defaultRetryDelayMs must not be negative");
            }
            this.defaultRetryDelayMs = defaultRetryDelayMs;
            return this;
        }

        public <T> ConcurrencyController<T> build() {
            return new ConcurrencyController<>(this);
        }
    }
}

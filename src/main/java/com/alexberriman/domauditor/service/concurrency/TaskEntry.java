package com.alexberriman.domauditor.service.concurrency;

import java.util.Objects;

/**
 * A task paired with its diagnostic id, as submitted to
 * {@link ConcurrencyController#executeTasks(java.util.List)}.
 *
 * @param id   task id used in messages and logs (not a dedup key)
 * @param task the work to run
 */
public record TaskEntry<T>(String id, AsyncTask<T> task) {

    public TaskEntry {
        Objects.requireNonNull(id, "Task id must not be null");
        Objects.requireNonNull(task, "Task must not be null");
    }

    public static <T> TaskEntry<T> of(String id, AsyncTask<T> task) {
        return new TaskEntry<>(id, task);
    }
}

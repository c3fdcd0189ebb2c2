package com.alexberriman.domauditor.exception;

/**
 * Describes why a task submitted to the concurrency core did not produce a value.
 *
 * <p>Instances are normally carried inside a failed
 * {@link com.alexberriman.domauditor.service.concurrency.TaskResult} rather than thrown,
 * so one failing task never aborts its siblings.
 */
public class ConcurrencyException extends DomAuditorException {

    /**
     * Category of a concurrency failure.
     */
    public enum Kind {
        /** The controller was stopped; the task never ran. */
        REJECTED,
        /** The task itself failed. */
        TASK_FAILED,
        /** Every attempt of a retried task failed. */
        RETRIES_EXHAUSTED,
        /** The batch could not be scheduled at all. */
        BATCH_FAILED
    }

    private final String taskId;
    private final Kind kind;

    public ConcurrencyException(String message, String taskId, Kind kind) {
        super(message);
        this.taskId = taskId;
        this.kind = kind;
    }

    public ConcurrencyException(String message, String taskId, Kind kind, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.kind = kind;
    }

    /**
     * @return id of the task this failure belongs to, or {@code null} for batch-level failures
     */
    public String getTaskId() {
        return taskId;
    }

    public Kind getKind() {
        return kind;
    }
}

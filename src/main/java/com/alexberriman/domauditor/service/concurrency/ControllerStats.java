package com.alexberriman.domauditor.service.concurrency;

/**
 * Point-in-time snapshot of a {@link ConcurrencyController}.
 *
 * @param isStopped        whether the controller rejects new submissions
 * @param availablePermits permits not currently held
 * @param waitingTasks     submissions queued for a permit
 * @param runningTasks     tasks holding a permit ({@code capacity - availablePermits})
 */
public record ControllerStats(
        boolean isStopped,
        int availablePermits,
        int waitingTasks,
        int runningTasks
) {
}

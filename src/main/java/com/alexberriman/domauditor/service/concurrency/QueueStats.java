package com.alexberriman.domauditor.service.concurrency;

/**
 * Snapshot of a {@link TaskQueue}.
 *
 * @param queueLength     submissions waiting for a permit
 * @param controllerStats stats of the underlying controller
 */
public record QueueStats(int queueLength, ControllerStats controllerStats) {
}

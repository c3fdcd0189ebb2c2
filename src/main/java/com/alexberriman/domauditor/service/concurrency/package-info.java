/**
 * Bounded-concurrency execution core.
 *
 * <p>Components, each built on the one before it:
 * <ul>
 *   <li>{@link com.alexberriman.domauditor.service.concurrency.FifoSemaphore} - counting
 *       semaphore with FIFO, non-blocking admission</li>
 *   <li>{@link com.alexberriman.domauditor.service.concurrency.ConcurrencyController} - runs
 *       tasks under the semaphore with error isolation, batches, retry and shutdown</li>
 *   <li>{@link com.alexberriman.domauditor.service.concurrency.TaskQueue} - queue-shaped
 *       facade over a controller</li>
 * </ul>
 *
 * <p>Every entry point returns a {@link com.alexberriman.domauditor.service.concurrency.TaskResult}
 * so that one failing task never aborts a batch. The core never inspects what a task computes.
 *
 * @since 1.0
 */
package com.alexberriman.domauditor.service.concurrency;

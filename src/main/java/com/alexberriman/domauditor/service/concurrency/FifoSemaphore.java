package com.alexberriman.domauditor.service.concurrency;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting semaphore with strictly FIFO, non-blocking admission.
 *
 * <p>{@link #acquire()} never blocks the calling thread. It returns a future that is already
 * complete when a permit is free, or a pending future that is completed by a later
 * {@link #release()}. A released permit is handed directly to the longest waiting caller, so a
 * fresh {@code acquire()} can never overtake a queued one.
 *
 * <p><b>Thread Safety:</b> The permit count and the waiter list are guarded by a single
 * {@link ReentrantLock}. Waiter futures are completed after the lock is released so that
 * stages chained on them never run while it is held.
 *
 * @since 1.0
 */
public final class FifoSemaphore {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int available;

    /**
     * Creates a semaphore with {@code capacity} free permits.
     *
     * @param capacity total number of permits
     * @throws IllegalArgumentException if capacity is not positive
     */
    public FifoSemaphore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Semaphore capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.available = capacity;
    }

    /**
     * Requests a permit.
     *
     * <p>If a permit is free it is taken immediately and a completed future is returned.
     * Otherwise the caller is queued and the returned future completes once a permit has
     * been transferred to it. Cancelling a pending future gives up the place in line; the
     * permit it would have received goes to the next waiter.
     *
     * @return future completing when the caller holds a permit
     */
    public CompletableFuture<Void> acquire() {
        lock.lock();
        try {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a permit, handing it to the head waiter if there is one.
     *
     * @throws IllegalStateException if more permits are released than were acquired
     */
    public void release() {
        while (true) {
            CompletableFuture<Void> next;
            lock.lock();
            try {
                next = waiters.pollFirst();
                if (next == null) {
                    if (available >= capacity) {
                        throw new IllegalStateException(
                                "Semaphore released more times than acquired (capacity " + capacity + ")");
                    }
                    available++;
                    return;
                }
            } finally {
                lock.unlock();
            }
            // complete() is false only for a waiter cancelled by its caller; pass the permit on
            if (next.complete(null)) {
                return;
            }
        }
    }

    /**
     * @return number of permits not currently held
     */
    public int availablePermits() {
        lock.lock();
        try {
            return available;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of callers queued for a permit
     */
    public int waitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}

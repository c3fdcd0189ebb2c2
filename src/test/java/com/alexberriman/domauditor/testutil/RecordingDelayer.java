package com.alexberriman.domauditor.testutil;

import com.alexberriman.domauditor.service.concurrency.Delayer;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delayer that records every requested delay and completes immediately.
 * An optional hook runs on each delay, e.g. to stop a controller between retry attempts.
 */
public class RecordingDelayer implements Delayer {

    private final List<Long> delays = new CopyOnWriteArrayList<>();
    private final Runnable onDelay;

    public RecordingDelayer() {
        this(() -> { });
    }

    public RecordingDelayer(Runnable onDelay) {
        this.onDelay = onDelay;
    }

    @Override
    public CompletableFuture<Void> delay(long millis) {
        delays.add(millis);
        onDelay.run();
        return CompletableFuture.completedFuture(null);
    }

    public List<Long> delays() {
        return delays;
    }
}

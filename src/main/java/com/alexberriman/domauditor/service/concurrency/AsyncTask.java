package com.alexberriman.domauditor.service.concurrency;

import java.util.concurrent.CompletionStage;

/**
 * A zero-argument asynchronous unit of work.
 *
 * <p>{@link #start()} begins the work and returns a stage that completes with its value or
 * exceptionally with its failure. Throwing from {@code start()} counts as a failure as well.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface AsyncTask<T> {

    CompletionStage<T> start() throws Exception;
}

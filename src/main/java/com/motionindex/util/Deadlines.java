package com.motionindex.util;

import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking call on an executor and waits for it with a deadline.
 * A call that misses its deadline is cancelled (interrupted) and abandoned.
 */
public final class Deadlines {

    private Deadlines() {
        // Utility class
    }

    /**
     * Submits the call and waits at most {@code timeout} for its result.
     *
     * @throws TimeoutException     if the deadline elapsed first
     * @throws ExecutionException   if the call itself threw; use {@link #unwrap(ExecutionException)}
     * @throws InterruptedException if the waiting thread was interrupted
     */
    public static <T> T await(AsyncTaskExecutor executor, Duration timeout, Callable<T> call)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<T> future = executor.submit(call);
        try {
            return future.get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Returns the exception thrown by the submitted call. Errors are rethrown as is.
     */
    public static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return e;
    }
}

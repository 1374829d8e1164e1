package com.redhat.ci.steps;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Carries the cancellation signal of one step execution. Once the context is done every wait performed
 * through it ends with a {@link CancellationException}.
 */
public final class StepContext {

    static final String CANCELED = "context canceled";
    static final String DEADLINE_EXCEEDED = "context deadline exceeded";

    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final AtomicReference<String> cause = new AtomicReference<>();

    private StepContext() {
    }

    public static StepContext create() {
        return new StepContext();
    }

    public static StepContext withTimeout(Duration timeout) {
        StepContext context = new StepContext();
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> context.finish(DEADLINE_EXCEEDED));
        return context;
    }

    public void cancel() {
        finish(CANCELED);
    }

    private void finish(String reason) {
        if (cause.compareAndSet(null, reason)) {
            done.complete(null);
        }
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * The error describing why the context is done, or {@code null} while it is still live.
     */
    public CancellationException err() {
        String reason = cause.get();
        return reason == null ? null : new CancellationException(reason);
    }

    public void checkCancelled() {
        if (isDone()) {
            throw err();
        }
    }

    /**
     * Sleeps for the given duration, returning early with a {@link CancellationException} if the context
     * finishes first.
     */
    public void sleep(Duration duration) {
        checkCancelled();
        try {
            done.get(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
        throw err();
    }

    /**
     * Waits for a task started on behalf of this context. Cancellation of the context wins over the result
     * of the task, in which case the task is cancelled as well.
     *
     * @throws ExecutionException if the task failed, with the failure as cause
     */
    public <T> T await(CompletableFuture<T> task) throws ExecutionException {
        try {
            CompletableFuture.anyOf(task, done).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            throw new CancellationException("interrupted");
        } catch (ExecutionException e) {
            //the task failed, reported below unless the context finished too
        }
        if (isDone()) {
            task.cancel(true);
            throw err();
        }
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted");
        }
    }
}

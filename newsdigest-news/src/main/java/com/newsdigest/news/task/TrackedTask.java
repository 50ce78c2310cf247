package com.newsdigest.news.task;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to a task started by {@link TaskSupervisor}.
 */
public class TrackedTask<T> {

    private final String name;
    private final Instant startedAt;
    private final CancellationToken token;
    private final CompletableFuture<T> future = new CompletableFuture<>();

    private volatile TaskState state = TaskState.RUNNING;
    private volatile Instant finishedAt;
    private volatile Throwable failure;

    TrackedTask(String name, CancellationToken token) {
        this.name = name;
        this.token = token;
        this.startedAt = Instant.now();
    }

    void complete(T result) {
        finishedAt = Instant.now();
        state = TaskState.COMPLETED;
        future.complete(result);
    }

    void fail(Throwable error) {
        finishedAt = Instant.now();
        failure = error;
        state = error instanceof CancelledException ? TaskState.CANCELLED : TaskState.FAILED;
        future.completeExceptionally(error);
    }

    public String getName() {
        return name;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public TaskState getState() {
        return state;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isCancelRequested() {
        return token.isCancelled();
    }

    /**
     * Request cancellation. The task stops at its next checkpoint.
     */
    public void cancel() {
        token.cancel();
    }

    /**
     * Wait for the task to finish.
     *
     * @return the result, or empty if the task failed or was cancelled
     * @throws TimeoutException if it is still running after the timeout
     */
    public Optional<T> await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            return Optional.empty();
        }
    }
}

package com.newsdigest.news.task;

/**
 * Cooperative cancellation flag shared between a caller and a long-running operation.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() throws CancelledException {
        if (cancelled) {
            throw new CancelledException("Operation cancelled");
        }
    }
}

package com.newsdigest.news.task;

/**
 * Background work that observes a cancellation token.
 */
@FunctionalInterface
public interface CancellableTask<T> {

    T run(CancellationToken token) throws Exception;
}

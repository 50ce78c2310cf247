package com.newsdigest.news.task;

/**
 * An operation stopped early because its token was cancelled. Not a failure.
 */
public class CancelledException extends Exception {

    public CancelledException(String message) {
        super(message);
    }
}

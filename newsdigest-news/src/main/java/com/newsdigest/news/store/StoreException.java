package com.newsdigest.news.store;

/**
 * A read or write against the content store failed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

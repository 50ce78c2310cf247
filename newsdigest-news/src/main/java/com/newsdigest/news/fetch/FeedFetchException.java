package com.newsdigest.news.fetch;

/**
 * A feed could not be downloaded or parsed.
 */
public class FeedFetchException extends Exception {

    private final String feedUrl;

    public FeedFetchException(String feedUrl, String message) {
        super(message);
        this.feedUrl = feedUrl;
    }

    public FeedFetchException(String feedUrl, String message, Throwable cause) {
        super(message, cause);
        this.feedUrl = feedUrl;
    }

    public String getFeedUrl() {
        return feedUrl;
    }
}

package com.newsdigest.news.fetch;

import java.util.List;

/**
 * Reads the current items of a feed.
 */
public interface FeedReader {

    List<FeedEntry> read(String feedUrl) throws FeedFetchException;
}

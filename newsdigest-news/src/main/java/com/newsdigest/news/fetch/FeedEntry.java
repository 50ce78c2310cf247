package com.newsdigest.news.fetch;

import java.time.Instant;

/**
 * One item as read from a feed, before it is stored.
 *
 * @param publishedAt feed date, or null when the feed carries none
 */
public record FeedEntry(
    String title,
    String link,
    String content,
    Instant publishedAt
) {}

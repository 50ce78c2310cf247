package com.newsdigest.news.fetch;

/**
 * Outcome of one pass over all enabled sources.
 */
public record IngestionSummary(
    int sources,
    int succeeded,
    int failed,
    int newArticles
) {}

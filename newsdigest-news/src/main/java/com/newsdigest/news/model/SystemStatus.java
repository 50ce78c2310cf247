package com.newsdigest.news.model;

import java.time.Instant;

/**
 * Point-in-time counts for the status endpoint.
 */
public record SystemStatus(
    ArticleCounts articles,
    SourceCounts sources,
    Instant nextFetchTime,      // null when no scheduler is running
    Instant nextProcessTime,
    Instant generatedAt
) {
    public record ArticleCounts(int total, int pending, int processed, int filtered) {}

    public record SourceCounts(int total, int enabled) {}
}

package com.newsdigest.news.model;

import java.time.Instant;

/**
 * A subscribed RSS or Atom feed.
 */
public record Source(
    long id,
    String name,
    String url,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt
) {}

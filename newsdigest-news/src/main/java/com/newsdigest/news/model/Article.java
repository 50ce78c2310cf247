package com.newsdigest.news.model;

import java.time.Instant;

/**
 * One feed item. The link is the natural key; the id is assigned by the store.
 * {@code processedAt} is set exactly when the status is terminal.
 */
public record Article(
    long id,                    // 0 until stored
    long sourceId,
    String title,
    String link,                // Unique across all sources
    String content,             // Feed description, may be empty
    Instant publishedAt,        // Feed date, or ingestion time when the feed has none
    ArticleStatus status,
    String summary,             // Summary when PROCESSED, filter reason when FILTERED
    Instant processedAt,
    Instant createdAt
) {
    public Article {
        if (status == null) status = ArticleStatus.PENDING;
        if (title == null) title = "";
        if (content == null) content = "";
    }

    /**
     * Terminal copy for an article the filter rejected. The reason is kept in the summary column.
     */
    public Article filtered(String reason, Instant now) {
        requirePending();
        return toBuilder()
            .status(ArticleStatus.FILTERED)
            .summary(reason == null ? "" : reason)
            .processedAt(now)
            .build();
    }

    /**
     * Terminal copy for an article that passed the filter and got a summary.
     */
    public Article processed(String summary, Instant now) {
        requirePending();
        return toBuilder()
            .status(ArticleStatus.PROCESSED)
            .summary(summary)
            .processedAt(now)
            .build();
    }

    /**
     * Text handed to the model: title, blank line, content.
     */
    public String modelInput() {
        return title + "\n\n" + content;
    }

    private void requirePending() {
        if (status != ArticleStatus.PENDING) {
            throw new IllegalStateException("Article " + id + " is already " + status);
        }
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .sourceId(sourceId)
            .title(title)
            .link(link)
            .content(content)
            .publishedAt(publishedAt)
            .status(status)
            .summary(summary)
            .processedAt(processedAt)
            .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private long sourceId;
        private String title = "";
        private String link;
        private String content = "";
        private Instant publishedAt;
        private ArticleStatus status = ArticleStatus.PENDING;
        private String summary;
        private Instant processedAt;
        private Instant createdAt;

        public Builder id(long id) { this.id = id; return this; }
        public Builder sourceId(long sourceId) { this.sourceId = sourceId; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder link(String link) { this.link = link; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }
        public Builder status(ArticleStatus status) { this.status = status; return this; }
        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder processedAt(Instant processedAt) { this.processedAt = processedAt; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public Article build() {
            return new Article(id, sourceId, title, link, content, publishedAt, status, summary,
                processedAt, createdAt);
        }
    }
}

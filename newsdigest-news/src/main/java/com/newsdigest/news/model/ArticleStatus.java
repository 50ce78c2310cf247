package com.newsdigest.news.model;

import java.util.Optional;

/**
 * Lifecycle of an article. PENDING is the only state that moves; the other two are terminal.
 */
public enum ArticleStatus {
    PENDING(0),
    PROCESSED(1),
    FILTERED(2);

    private final int code;

    ArticleStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static ArticleStatus fromCode(int code) {
        for (ArticleStatus status : values()) {
            if (status.code == code) return status;
        }
        throw new IllegalArgumentException("Unknown article status code: " + code);
    }

    /**
     * Lenient lookup for query parameters ("pending", "Processed", ...).
     */
    public static Optional<ArticleStatus> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        for (ArticleStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) return Optional.of(status);
        }
        return Optional.empty();
    }
}

package com.newsdigest.news.process;

/**
 * Counts at one point of a drain.
 */
public record ProgressSnapshot(int completed, int total, int succeeded, int failed) {

    public boolean isFinal() {
        return completed >= total;
    }
}

package com.newsdigest.news.process;

import com.newsdigest.news.task.CancelledException;

/**
 * A drain was cancelled. Carries what was done before it stopped.
 */
public class ProcessingCancelledException extends CancelledException {

    private final ProcessingStats stats;

    public ProcessingCancelledException(ProcessingStats stats) {
        super("Processing cancelled after " + stats.completed() + " articles");
        this.stats = stats;
    }

    public ProcessingStats getStats() {
        return stats;
    }
}

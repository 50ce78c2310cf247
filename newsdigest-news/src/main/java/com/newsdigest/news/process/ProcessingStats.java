package com.newsdigest.news.process;

import java.time.Duration;

/**
 * Result of one drain of the pending queue.
 */
public record ProcessingStats(
    int initialPending,
    int succeeded,
    int failed,
    int batches,
    Duration duration
) {
    public static ProcessingStats empty() {
        return new ProcessingStats(0, 0, 0, 0, Duration.ZERO);
    }

    public int completed() {
        return succeeded + failed;
    }
}

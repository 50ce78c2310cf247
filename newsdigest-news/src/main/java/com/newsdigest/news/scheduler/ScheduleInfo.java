package com.newsdigest.news.scheduler;

import java.time.Instant;

/**
 * Next planned runs of the periodic jobs. Either may be null when the job is not scheduled.
 */
public interface ScheduleInfo {

    Instant getNextFetchTime();

    Instant getNextProcessTime();
}

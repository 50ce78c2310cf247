package com.newsdigest.news.status;

import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.model.SystemStatus;
import com.newsdigest.news.scheduler.ScheduleInfo;
import com.newsdigest.news.store.NewsStore;

import java.time.Clock;

/**
 * Builds the status snapshot from store counts and the scheduler's next run times.
 */
public class StatusService {

    private final NewsStore store;
    private final Clock clock;
    private volatile ScheduleInfo schedule;

    public StatusService(NewsStore store) {
        this(store, Clock.systemUTC());
    }

    public StatusService(NewsStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void attachSchedule(ScheduleInfo schedule) {
        this.schedule = schedule;
    }

    public SystemStatus snapshot() {
        SystemStatus.ArticleCounts articles = new SystemStatus.ArticleCounts(
            store.countArticles(null),
            store.countArticles(ArticleStatus.PENDING),
            store.countArticles(ArticleStatus.PROCESSED),
            store.countArticles(ArticleStatus.FILTERED)
        );
        SystemStatus.SourceCounts sources = new SystemStatus.SourceCounts(
            store.countSources(false),
            store.countSources(true)
        );

        ScheduleInfo current = schedule;
        return new SystemStatus(
            articles,
            sources,
            current != null ? current.getNextFetchTime() : null,
            current != null ? current.getNextProcessTime() : null,
            clock.instant()
        );
    }
}

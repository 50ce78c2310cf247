package com.newsdigest.news.fetch;

import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.model.Source;
import com.newsdigest.news.store.NewsStore;
import com.newsdigest.news.store.StoredArticle;
import com.newsdigest.news.task.CancellationToken;
import com.newsdigest.news.task.CancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Pulls feeds into the store. Items are deduplicated by link, so re-fetching a feed is harmless
 * and only genuinely new items are counted.
 */
public class FeedIngestionService {

    private static final Logger log = LoggerFactory.getLogger(FeedIngestionService.class);

    private final NewsStore store;
    private final FeedReader reader;
    private final Clock clock;

    public FeedIngestionService(NewsStore store, FeedReader reader) {
        this(store, reader, Clock.systemUTC());
    }

    public FeedIngestionService(NewsStore store, FeedReader reader, Clock clock) {
        this.store = store;
        this.reader = reader;
        this.clock = clock;
    }

    /**
     * Fetch one source by id.
     *
     * @throws IllegalArgumentException if no such source exists
     */
    public int fetchSource(long sourceId, CancellationToken token) throws FeedFetchException, CancelledException {
        Source source = store.getSource(sourceId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + sourceId));
        return fetchSource(source, token);
    }

    /**
     * Fetch one source and store its new items as PENDING.
     *
     * @return number of items that did not exist before
     */
    public int fetchSource(Source source, CancellationToken token) throws FeedFetchException, CancelledException {
        token.throwIfCancelled();
        Instant start = clock.instant();

        List<FeedEntry> entries = reader.read(source.url());

        int created = 0;
        int skipped = 0;
        for (FeedEntry entry : entries) {
            if (entry.link() == null || entry.link().isBlank()) {
                log.warn("Skipping entry without link in {}: {}", source.name(), entry.title());
                skipped++;
                continue;
            }

            Instant now = clock.instant();
            Article candidate = Article.builder()
                .sourceId(source.id())
                .title(entry.title() != null ? entry.title() : "")
                .link(entry.link())
                .content(entry.content() != null ? entry.content() : "")
                .publishedAt(entry.publishedAt() != null ? entry.publishedAt() : now)
                .status(ArticleStatus.PENDING)
                .createdAt(now)
                .build();

            StoredArticle stored = store.findOrCreateArticle(candidate);
            if (stored.created()) {
                created++;
            }
        }

        log.info("Fetched {} from {}: {} entries, {} new, {} skipped ({}ms)",
            source.name(), source.url(), entries.size(), created, skipped,
            Duration.between(start, clock.instant()).toMillis());
        return created;
    }

    /**
     * Fetch every enabled source in turn. A failing source is logged and counted, the rest still run.
     */
    public IngestionSummary fetchAllEnabled(CancellationToken token) throws CancelledException {
        List<Source> sources = store.listEnabledSources();
        log.info("Fetching {} enabled sources", sources.size());

        int succeeded = 0;
        int failed = 0;
        int newArticles = 0;
        for (Source source : sources) {
            token.throwIfCancelled();
            try {
                newArticles += fetchSource(source, token);
                succeeded++;
            } catch (FeedFetchException e) {
                log.warn("Failed to fetch {}: {}", source.url(), e.getMessage());
                failed++;
            } catch (RuntimeException e) {
                log.error("Error ingesting {}: {}", source.url(), e.getMessage(), e);
                failed++;
            }
        }

        IngestionSummary summary = new IngestionSummary(sources.size(), succeeded, failed, newArticles);
        log.info("Fetch complete: {} sources, {} ok, {} failed, {} new articles",
            summary.sources(), succeeded, failed, newArticles);
        return summary;
    }
}

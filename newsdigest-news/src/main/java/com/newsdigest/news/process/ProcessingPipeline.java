package com.newsdigest.news.process;

import com.newsdigest.ai.ModelException;
import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.store.ArticleQuery;
import com.newsdigest.news.store.NewsStore;
import com.newsdigest.news.task.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains the PENDING queue in batches with at most {@code concurrency} articles in flight.
 *
 * <p>Each batch is joined before the next one is fetched. Articles that fail in a drain are not
 * fetched again by the same drain, so one that keeps failing waits for the next run instead of
 * looping. Successful articles leave the PENDING state and need no exclusion. Cancellation stops dispatching, lets in-flight articles finish and then raises
 * {@link ProcessingCancelledException}.
 */
public class ProcessingPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessingPipeline.class);

    public static final int DEFAULT_CONCURRENCY = 3;
    public static final int DEFAULT_PROGRESS_INTERVAL = 10;

    private final NewsStore store;
    private final ArticleProcessor processor;
    private final int concurrency;
    private final int progressInterval;
    private final Semaphore slots;
    private final ExecutorService workers;

    public ProcessingPipeline(NewsStore store, ArticleProcessor processor) {
        this(store, processor, DEFAULT_CONCURRENCY, DEFAULT_PROGRESS_INTERVAL);
    }

    public ProcessingPipeline(NewsStore store, ArticleProcessor processor, int concurrency, int progressInterval) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        this.store = store;
        this.processor = processor;
        this.concurrency = concurrency;
        this.progressInterval = progressInterval;
        this.slots = new Semaphore(concurrency);
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "digest-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public int getConcurrency() {
        return concurrency;
    }

    public ProcessingStats processPending(int batchSize, CancellationToken token)
            throws ProcessingCancelledException {
        return processPending(batchSize, token, ProgressListener.NONE);
    }

    /**
     * Process PENDING articles until none are left that have not already failed in this drain.
     *
     * @param batchSize articles fetched per round, newest first
     */
    public ProcessingStats processPending(int batchSize, CancellationToken token, ProgressListener listener)
            throws ProcessingCancelledException {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
        }

        int total = store.countArticles(ArticleStatus.PENDING);
        if (total == 0) {
            log.info("No pending articles");
            return ProcessingStats.empty();
        }

        Instant start = Instant.now();
        log.info("Processing {} pending articles (batch {}, concurrency {})", total, batchSize, concurrency);

        ProgressTracker tracker = new ProgressTracker(total, progressInterval, listener);
        Set<Long> failedIds = ConcurrentHashMap.newKeySet();
        int batches = 0;

        while (true) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                throw cancelled(total, tracker, batches, start);
            }

            List<Article> batch = store.findArticles(ArticleQuery.pending(batchSize, failedIds));
            if (batch.isEmpty()) {
                break;
            }
            batches++;

            List<Future<?>> inFlight = new ArrayList<>(batch.size());
            boolean stopped = false;
            for (Article article : batch) {
                if (token.isCancelled()) {
                    stopped = true;
                    break;
                }
                try {
                    slots.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopped = true;
                    break;
                }
                try {
                    inFlight.add(workers.submit(() -> processOne(article, tracker, failedIds)));
                } catch (RejectedExecutionException e) {
                    slots.release();
                    throw e;
                }
            }

            if (awaitAll(inFlight)) {
                stopped = true;
            }
            if (stopped) {
                throw cancelled(total, tracker, batches, start);
            }
        }

        ProgressSnapshot last = tracker.finish();
        ProcessingStats stats = new ProcessingStats(total, last.succeeded(), last.failed(), batches,
            Duration.between(start, Instant.now()));
        log.info("Processing complete: {} succeeded, {} failed in {} batches ({}ms)",
            stats.succeeded(), stats.failed(), batches, stats.duration().toMillis());
        return stats;
    }

    private void processOne(Article article, ProgressTracker tracker, Set<Long> failedIds) {
        try {
            processor.process(article);
            tracker.recordSuccess();
        } catch (ModelException e) {
            log.warn("Failed to process article {} ({}): {} [{}]",
                article.id(), article.link(), e.getMessage(), e.getType());
            failedIds.add(article.id());
            tracker.recordFailure();
        } catch (RuntimeException e) {
            log.error("Error processing article {} ({}): {}", article.id(), article.link(), e.getMessage(), e);
            failedIds.add(article.id());
            tracker.recordFailure();
        } finally {
            slots.release();
        }
    }

    /**
     * Wait for every future, even when interrupted.
     *
     * @return true if the calling thread was interrupted while waiting
     */
    private boolean awaitAll(List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    log.error("Worker failed unexpectedly: {}", e.getCause().getMessage(), e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return interrupted;
    }

    private ProcessingCancelledException cancelled(int total, ProgressTracker tracker, int batches, Instant start) {
        ProgressSnapshot snapshot = tracker.finish();
        ProcessingStats stats = new ProcessingStats(total, snapshot.succeeded(), snapshot.failed(), batches,
            Duration.between(start, Instant.now()));
        log.info("Processing cancelled: {} succeeded, {} failed before stop", stats.succeeded(), stats.failed());
        return new ProcessingCancelledException(stats);
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers still busy after 30s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

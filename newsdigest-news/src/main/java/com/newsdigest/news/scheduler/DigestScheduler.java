package com.newsdigest.news.scheduler;

import com.newsdigest.news.fetch.FeedIngestionService;
import com.newsdigest.news.fetch.IngestionSummary;
import com.newsdigest.news.process.ProcessingPipeline;
import com.newsdigest.news.process.ProcessingStats;
import com.newsdigest.news.task.TaskSupervisor;
import com.newsdigest.news.task.TrackedTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic fetch and process jobs. Both go through the {@link TaskSupervisor}, so a slow run is
 * never overlapped by the next tick and manual triggers share the same guard.
 */
public class DigestScheduler implements ScheduleInfo, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DigestScheduler.class);

    public static final String INGEST_TASK = "ingest-all";
    public static final String PROCESS_TASK = "process";

    private final FeedIngestionService ingestion;
    private final ProcessingPipeline pipeline;
    private final TaskSupervisor supervisor;
    private final ScheduledExecutorService scheduler;

    private Duration fetchInterval = Duration.ofMinutes(30);
    private Duration processInterval = Duration.ofMinutes(10);
    private int processBatchSize = 5;

    private volatile boolean running = false;
    private volatile Instant nextFetchTime;
    private volatile Instant nextProcessTime;
    private ScheduledFuture<?> fetchTask;
    private ScheduledFuture<?> processTask;

    public DigestScheduler(FeedIngestionService ingestion, ProcessingPipeline pipeline, TaskSupervisor supervisor) {
        this.ingestion = ingestion;
        this.pipeline = pipeline;
        this.supervisor = supervisor;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "digest-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Set fetch interval (default: 30 minutes).
     */
    public DigestScheduler withFetchInterval(Duration interval) {
        this.fetchInterval = interval;
        return this;
    }

    /**
     * Set process interval (default: 10 minutes).
     */
    public DigestScheduler withProcessInterval(Duration interval) {
        this.processInterval = interval;
        return this;
    }

    /**
     * Set articles fetched per processing batch (default: 5).
     */
    public DigestScheduler withProcessBatchSize(int batchSize) {
        this.processBatchSize = batchSize;
        return this;
    }

    public synchronized void start() {
        if (running) return;
        running = true;

        log.info("Starting scheduler (fetch every {}, process every {}, batch {})",
            fetchInterval, processInterval, processBatchSize);

        nextFetchTime = Instant.now().plus(fetchInterval);
        nextProcessTime = Instant.now().plus(processInterval);
        fetchTask = scheduler.scheduleAtFixedRate(this::runFetch,
            fetchInterval.toMillis(), fetchInterval.toMillis(), TimeUnit.MILLISECONDS);
        processTask = scheduler.scheduleAtFixedRate(this::runProcess,
            processInterval.toMillis(), processInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;

        if (fetchTask != null) fetchTask.cancel(false);
        if (processTask != null) processTask.cancel(false);
        nextFetchTime = null;
        nextProcessTime = null;
        log.info("Stopped scheduler");
    }

    /**
     * Submit a fetch of all enabled sources, or return the one already running.
     */
    public TrackedTask<IngestionSummary> triggerFetch() {
        return supervisor.submit(INGEST_TASK, ingestion::fetchAllEnabled);
    }

    /**
     * Submit a drain of the pending queue, or return the one already running.
     */
    public TrackedTask<ProcessingStats> triggerProcess(int batchSize) {
        return supervisor.submit(PROCESS_TASK, token -> pipeline.processPending(batchSize, token));
    }

    private void runFetch() {
        nextFetchTime = Instant.now().plus(fetchInterval);
        try {
            log.info("Scheduled fetch");
            triggerFetch();
        } catch (RuntimeException e) {
            log.error("Scheduled fetch failed to start: {}", e.getMessage(), e);
        }
    }

    private void runProcess() {
        nextProcessTime = Instant.now().plus(processInterval);
        try {
            log.info("Scheduled processing");
            triggerProcess(processBatchSize);
        } catch (RuntimeException e) {
            log.error("Scheduled processing failed to start: {}", e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public Instant getNextFetchTime() {
        return nextFetchTime;
    }

    @Override
    public Instant getNextProcessTime() {
        return nextProcessTime;
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

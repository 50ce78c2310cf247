package com.newsdigest.news;

import com.newsdigest.ai.HttpModelGateway;
import com.newsdigest.news.api.ArticleHandler;
import com.newsdigest.news.api.DigestApiServer;
import com.newsdigest.news.api.FeedHandler;
import com.newsdigest.news.api.ModelHandler;
import com.newsdigest.news.api.SettingsHandler;
import com.newsdigest.news.api.StatusHandler;
import com.newsdigest.news.config.DigestConfig;
import com.newsdigest.news.fetch.FeedIngestionService;
import com.newsdigest.news.fetch.RssFeedReader;
import com.newsdigest.news.process.ArticleProcessor;
import com.newsdigest.news.process.DefaultSettings;
import com.newsdigest.news.process.ProcessingPipeline;
import com.newsdigest.news.scheduler.DigestScheduler;
import com.newsdigest.news.status.StatusService;
import com.newsdigest.news.store.SqliteNewsStore;
import com.newsdigest.news.task.TaskSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * News Digest - pulls RSS feeds, filters articles with a language model and summarizes the ones worth reading.
 *
 * Usage: {@code java -jar newsdigest-news.jar [config.yaml]}
 */
public class NewsDigestApp {
    private static final Logger LOG = LoggerFactory.getLogger(NewsDigestApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private static final AtomicBoolean cleanedUp = new AtomicBoolean(false);

    private static SqliteNewsStore store;
    private static ProcessingPipeline pipeline;
    private static TaskSupervisor supervisor;
    private static DigestScheduler scheduler;
    private static DigestApiServer server;

    public static void main(String[] args) {
        LOG.info("Starting News Digest...");

        try {
            Path configPath = args.length > 0 ? Path.of(args[0]) : DigestConfig.DEFAULT_PATH;
            DigestConfig config = DigestConfig.load(configPath);

            store = new SqliteNewsStore(Path.of(config.getDatabase().getPath()));
            DefaultSettings.seed(store);

            HttpModelGateway gateway = new HttpModelGateway(store,
                config.getModel().connectTimeout(), config.getModel().callTimeout());

            FeedIngestionService ingestion = new FeedIngestionService(store, new RssFeedReader());
            ArticleProcessor processor = new ArticleProcessor(store, gateway);
            pipeline = new ProcessingPipeline(store, processor,
                config.getPipeline().getConcurrency(), config.getPipeline().getProgressInterval());
            supervisor = new TaskSupervisor();

            scheduler = new DigestScheduler(ingestion, pipeline, supervisor)
                .withFetchInterval(config.getSchedule().fetchInterval())
                .withProcessInterval(config.getSchedule().processInterval())
                .withProcessBatchSize(config.getSchedule().getProcessBatchSize());

            StatusService statusService = new StatusService(store);
            statusService.attachSchedule(scheduler);

            server = new DigestApiServer(config.getServer().getPort(),
                new FeedHandler(store, ingestion, scheduler),
                new ArticleHandler(store, scheduler, supervisor),
                new SettingsHandler(store),
                new ModelHandler(gateway),
                new StatusHandler(statusService, supervisor));

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down News Digest...");
                cleanup();
                shutdownLatch.countDown();
            }, "digest-shutdown"));

            server.start();
            if (config.getSchedule().isEnabled()) {
                scheduler.start();
            } else {
                LOG.info("Scheduler disabled by config");
            }
            LOG.info("News Digest started on port {}", server.getPort());

            shutdownLatch.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cleanup();
        } catch (Exception e) {
            LOG.error("Failed to start News Digest", e);
            cleanup();
            System.exit(1);
        }
    }

    private static void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) return;

        if (server != null) {
            server.stop();
        }
        if (scheduler != null) {
            scheduler.close();
        }
        if (supervisor != null) {
            supervisor.close();
        }
        if (pipeline != null) {
            pipeline.close();
        }
        if (store != null) {
            store.close();
        }
    }
}

package com.newsdigest.news.process;

import com.newsdigest.ai.ModelException;
import com.newsdigest.ai.ModelGateway;
import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.store.ArticleQuery;
import com.newsdigest.news.store.SqliteNewsStore;
import com.newsdigest.news.task.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProcessingPipeline with stub model gateways.
 */
class ProcessingPipelineTest {

    private static final Instant BASE = Instant.parse("2024-10-01T00:00:00Z");
    private static final String WORTH = "{\"worth\": true, \"reason\": \"relevant\"}";
    private static final String NOT_WORTH = "{\"worth\": false, \"reason\": \"noise\"}";

    @TempDir
    Path tempDir;

    private SqliteNewsStore store;
    private ProcessingPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new SqliteNewsStore(tempDir.resolve("news.db"));
        DefaultSettings.seed(store);
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) pipeline.close();
        store.close();
    }

    private void seedPending(int count) {
        for (int i = 0; i < count; i++) {
            store.findOrCreateArticle(Article.builder()
                .sourceId(1)
                .title("Article " + i)
                .link("https://example.com/" + i)
                .content("content " + i)
                .publishedAt(BASE.plusSeconds(i))
                .build());
        }
    }

    private ProcessingPipeline pipeline(ModelGateway gateway, int concurrency) {
        pipeline = new ProcessingPipeline(store, new ArticleProcessor(store, gateway), concurrency, 10);
        return pipeline;
    }

    private static String summarizeOrAccept(String system) {
        return system.equals(DefaultSettings.FILTER_PROMPT) ? WORTH : "summary";
    }

    @Nested
    @DisplayName("Drain")
    class Drain {

        @Test
        @DisplayName("Should be a no-op without pending articles")
        void emptyQueue() throws Exception {
            // Given
            AtomicInteger calls = new AtomicInteger();

            // When
            ProcessingStats stats = pipeline((s, u) -> {
                calls.incrementAndGet();
                return WORTH;
            }, 3).processPending(5, CancellationToken.none());

            // Then
            assertEquals(0, stats.completed());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("Should leave no pending articles after a successful drain")
        void drainsEverything() throws Exception {
            // Given
            seedPending(23);

            // When
            ProcessingStats stats = pipeline((s, u) -> summarizeOrAccept(s), 3)
                .processPending(5, CancellationToken.none());

            // Then
            assertEquals(23, stats.initialPending());
            assertEquals(23, stats.succeeded());
            assertEquals(0, stats.failed());
            assertEquals(5, stats.batches());
            assertEquals(0, store.countArticles(ArticleStatus.PENDING));
            assertEquals(23, store.countArticles(ArticleStatus.PROCESSED));
        }

        @Test
        @DisplayName("Should never run more model calls at once than the concurrency width")
        void concurrencyBound() throws Exception {
            // Given
            seedPending(20);
            AtomicInteger active = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            ModelGateway gateway = (system, user) -> {
                int now = active.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(15);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    active.decrementAndGet();
                }
                return NOT_WORTH;
            };

            // When
            ProcessingStats stats = pipeline(gateway, 3).processPending(10, CancellationToken.none());

            // Then
            assertEquals(20, stats.succeeded());
            assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
        }

        @Test
        @DisplayName("Should count failures, keep them pending and still finish")
        void failuresStayPending() throws Exception {
            // Given
            seedPending(10);
            ModelGateway gateway = (system, user) -> {
                if (user.startsWith("Article 3") || user.startsWith("Article 7")) {
                    throw new ModelException(ModelException.ErrorType.TRANSPORT, "connection reset");
                }
                return NOT_WORTH;
            };

            // When
            ProcessingStats stats = pipeline(gateway, 3).processPending(4, CancellationToken.none());

            // Then
            assertEquals(8, stats.succeeded());
            assertEquals(2, stats.failed());
            assertEquals(2, store.countArticles(ArticleStatus.PENDING));
            assertEquals(8, store.countArticles(ArticleStatus.FILTERED));
        }

        @Test
        @DisplayName("Should finish a drain with more failures than SQLite accepts as bound parameters")
        void manyFailuresStillFinish() throws Exception {
            // Given
            seedPending(620);
            AtomicInteger calls = new AtomicInteger();
            ModelGateway gateway = (system, user) -> {
                calls.incrementAndGet();
                throw new ModelException(ModelException.ErrorType.TRANSPORT, "connection refused");
            };

            // When
            ProcessingStats stats = pipeline(gateway, 3).processPending(50, CancellationToken.none());

            // Then
            assertEquals(620, stats.failed());
            assertEquals(620, calls.get());
            assertEquals(620, store.countArticles(ArticleStatus.PENDING));
        }

        @Test
        @DisplayName("Should retry failed articles on the next drain")
        void nextDrainRetries() throws Exception {
            // Given
            seedPending(3);
            AtomicBoolean failing = new AtomicBoolean(true);
            ModelGateway gateway = (system, user) -> {
                if (failing.get()) throw new ModelException(ModelException.ErrorType.HTTP_STATUS, "HTTP 500");
                return NOT_WORTH;
            };
            ProcessingPipeline p = pipeline(gateway, 2);
            p.processPending(2, CancellationToken.none());

            // When
            failing.set(false);
            ProcessingStats second = p.processPending(2, CancellationToken.none());

            // Then
            assertEquals(3, second.succeeded());
            assertEquals(0, store.countArticles(ArticleStatus.PENDING));
        }

        @Test
        @DisplayName("Should pick up articles inserted while draining")
        void picksUpNewArticles() throws Exception {
            // Given
            seedPending(5);
            AtomicBoolean inserted = new AtomicBoolean(false);
            ModelGateway gateway = (system, user) -> {
                if (inserted.compareAndSet(false, true)) {
                    store.findOrCreateArticle(Article.builder()
                        .sourceId(1)
                        .title("Late arrival")
                        .link("https://example.com/late")
                        .publishedAt(BASE.minusSeconds(100))
                        .build());
                }
                return NOT_WORTH;
            };

            // When
            ProcessingStats stats = pipeline(gateway, 3).processPending(2, CancellationToken.none());

            // Then
            assertEquals(6, stats.succeeded());
            assertEquals(0, store.countArticles(ArticleStatus.PENDING));
        }

        @Test
        @DisplayName("Should not touch terminal articles on a repeated drain")
        void terminalNotReprocessed() throws Exception {
            // Given
            seedPending(4);
            AtomicInteger calls = new AtomicInteger();
            ModelGateway gateway = (system, user) -> {
                calls.incrementAndGet();
                return summarizeOrAccept(system);
            };
            ProcessingPipeline p = pipeline(gateway, 3);
            p.processPending(10, CancellationToken.none());
            List<Article> before = store.findArticles(new ArticleQuery(null, Set.of(), 0, 10));

            // When
            ProcessingStats second = p.processPending(10, CancellationToken.none());

            // Then
            assertEquals(0, second.completed());
            assertEquals(8, calls.get());
            assertEquals(before, store.findArticles(new ArticleQuery(null, Set.of(), 0, 10)));
        }
    }

    @Nested
    @DisplayName("Progress")
    class Progress {

        @Test
        @DisplayName("Should report every ten completions and at the end")
        void reportsProgress() throws Exception {
            // Given
            seedPending(25);
            List<ProgressSnapshot> snapshots = new CopyOnWriteArrayList<>();

            // When
            pipeline((s, u) -> NOT_WORTH, 3)
                .processPending(5, CancellationToken.none(), snapshots::add);

            // Then
            List<Integer> completed = snapshots.stream().map(ProgressSnapshot::completed).sorted().toList();
            assertEquals(List.of(10, 20, 25), completed);
            assertTrue(snapshots.stream().anyMatch(ProgressSnapshot::isFinal));
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Should stop dispatching and leave no article half-done")
        void cancelMidDrain() {
            // Given
            seedPending(20);
            CancellationToken token = new CancellationToken();
            AtomicInteger calls = new AtomicInteger();
            ModelGateway gateway = (system, user) -> {
                if (calls.incrementAndGet() == 4) {
                    token.cancel();
                }
                return NOT_WORTH;
            };

            // When
            ProcessingCancelledException e = assertThrows(ProcessingCancelledException.class,
                () -> pipeline(gateway, 3).processPending(3, token));

            // Then
            ProcessingStats stats = e.getStats();
            assertTrue(stats.completed() < 20, "completed " + stats.completed());
            assertEquals(stats.completed(), calls.get());
            int filtered = store.countArticles(ArticleStatus.FILTERED);
            int pending = store.countArticles(ArticleStatus.PENDING);
            assertEquals(stats.succeeded(), filtered);
            assertEquals(20, filtered + pending);
        }

        @Test
        @DisplayName("Should not start anything when cancelled up front")
        void cancelledBeforeStart() {
            // Given
            seedPending(5);
            CancellationToken token = new CancellationToken();
            token.cancel();
            AtomicInteger calls = new AtomicInteger();

            // When
            ProcessingCancelledException e = assertThrows(ProcessingCancelledException.class,
                () -> pipeline((s, u) -> {
                    calls.incrementAndGet();
                    return NOT_WORTH;
                }, 3).processPending(5, token));

            // Then
            assertEquals(0, e.getStats().completed());
            assertEquals(0, calls.get());
            assertEquals(5, store.countArticles(ArticleStatus.PENDING));
        }
    }

    @Test
    @DisplayName("Should reject invalid widths and batch sizes")
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
            () -> new ProcessingPipeline(store, new ArticleProcessor(store, (s, u) -> WORTH), 0, 10));
        assertThrows(IllegalArgumentException.class,
            () -> pipeline((s, u) -> WORTH, 2).processPending(0, CancellationToken.none()));
    }
}

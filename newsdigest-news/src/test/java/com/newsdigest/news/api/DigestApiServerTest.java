package com.newsdigest.news.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.ai.HttpModelGateway;
import com.newsdigest.ai.SettingKeys;
import com.newsdigest.news.fetch.FeedEntry;
import com.newsdigest.news.fetch.FeedIngestionService;
import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.process.ArticleProcessor;
import com.newsdigest.news.process.DefaultSettings;
import com.newsdigest.news.process.ProcessingPipeline;
import com.newsdigest.news.scheduler.DigestScheduler;
import com.newsdigest.news.status.StatusService;
import com.newsdigest.news.store.ArticleQuery;
import com.newsdigest.news.store.SqliteNewsStore;
import com.newsdigest.news.task.TaskSupervisor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the JSON API against a real server on an ephemeral port.
 */
class DigestApiServerTest {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant BASE = Instant.parse("2024-10-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteNewsStore store;
    private TaskSupervisor supervisor;
    private ProcessingPipeline pipeline;
    private DigestScheduler scheduler;
    private DigestApiServer server;
    private final OkHttpClient client = new OkHttpClient();

    @BeforeEach
    void setUp() throws IOException {
        store = new SqliteNewsStore(tempDir.resolve("news.db"));
        DefaultSettings.seed(store);
        store.putSetting(SettingKeys.API_KEY, "");
        store.putSetting(SettingKeys.API_URL, "http://127.0.0.1:1");
        supervisor = new TaskSupervisor();

        FeedIngestionService ingestion = new FeedIngestionService(store, url -> List.of(
            new FeedEntry("Headline", url + "/story", "Body", BASE)));
        HttpModelGateway gateway = new HttpModelGateway(store, Duration.ofSeconds(2), Duration.ofSeconds(5));
        pipeline = new ProcessingPipeline(store, new ArticleProcessor(store, gateway));
        scheduler = new DigestScheduler(ingestion, pipeline, supervisor);
        StatusService status = new StatusService(store);
        status.attachSchedule(scheduler);

        server = new DigestApiServer(0,
            new FeedHandler(store, ingestion, scheduler),
            new ArticleHandler(store, scheduler, supervisor),
            new SettingsHandler(store),
            new ModelHandler(gateway),
            new StatusHandler(status, supervisor));
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        scheduler.close();
        supervisor.close();
        pipeline.close();
        store.close();
    }

    private record Reply(int code, JsonNode body) {}

    private Reply call(String method, String path, String json) throws IOException {
        RequestBody body = json != null ? RequestBody.create(json, JSON)
            : method.equals("POST") ? RequestBody.create("", JSON) : null;
        Request request = new Request.Builder()
            .url("http://localhost:" + server.getPort() + path)
            .method(method, body)
            .build();
        try (Response response = client.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            return new Reply(response.code(), text.isEmpty() ? null : MAPPER.readTree(text));
        }
    }

    private Reply get(String path) throws IOException {
        return call("GET", path, null);
    }

    private Reply post(String path, String json) throws IOException {
        return call("POST", path, json);
    }

    @Nested
    @DisplayName("Feeds")
    class Feeds {

        @Test
        @DisplayName("Should create, list and reject duplicate feeds")
        void createAndList() throws Exception {
            // When
            Reply created = post("/api/feeds", "{\"name\": \"Tech\", \"url\": \"https://feeds.example/tech\"}");
            Reply duplicate = post("/api/feeds", "{\"name\": \"Again\", \"url\": \"https://feeds.example/tech\"}");
            Reply list = get("/api/feeds");

            // Then
            assertEquals(201, created.code());
            assertEquals("Tech", created.body().path("name").asText());
            assertTrue(created.body().path("enabled").asBoolean());
            assertEquals(409, duplicate.code());
            assertEquals(200, list.code());
            assertEquals(1, list.body().size());
        }

        @Test
        @DisplayName("Should require name and url")
        void validation() throws Exception {
            assertEquals(400, post("/api/feeds", "{\"name\": \"Tech\"}").code());
            assertEquals(400, post("/api/feeds", "{not json").code());
        }

        @Test
        @DisplayName("Should fetch one source and report new articles")
        void fetchOne() throws Exception {
            // Given
            long id = store.createSource("Tech", "https://feeds.example/tech", true).id();

            // When
            Reply first = post("/api/feeds/" + id + "/fetch", null);
            Reply second = post("/api/feeds/" + id + "/fetch", null);

            // Then
            assertEquals(200, first.code());
            assertEquals(1, first.body().path("new_articles").asInt());
            assertEquals(0, second.body().path("new_articles").asInt());
            assertEquals(404, post("/api/feeds/999/fetch", null).code());
        }

        @Test
        @DisplayName("Should delete a source")
        void delete() throws Exception {
            long id = store.createSource("Tech", "https://feeds.example/tech", true).id();

            assertEquals(200, call("DELETE", "/api/feeds/" + id, null).code());
            assertEquals(404, call("DELETE", "/api/feeds/" + id, null).code());
            assertTrue(store.listSources().isEmpty());
        }
    }

    @Nested
    @DisplayName("Articles")
    class Articles {

        private void seed(int count) {
            for (int i = 0; i < count; i++) {
                store.findOrCreateArticle(Article.builder()
                    .sourceId(1).title("Article " + i).link("https://x.example/" + i)
                    .publishedAt(BASE.plusSeconds(i)).build());
            }
        }

        @Test
        @DisplayName("Should page articles newest first")
        void paging() throws Exception {
            // Given
            seed(25);

            // When
            Reply first = get("/api/articles");
            Reply second = get("/api/articles?page=2");

            // Then
            assertEquals(25, first.body().path("total").asInt());
            assertEquals(20, first.body().path("data").size());
            assertEquals("Article 24", first.body().path("data").get(0).path("title").asText());
            assertEquals(5, second.body().path("data").size());
            assertEquals(2, second.body().path("page").asInt());
        }

        @Test
        @DisplayName("Should filter by status")
        void statusFilter() throws Exception {
            seed(3);
            Article article = store.findArticles(
                ArticleQuery.page(null, 1, 1)).get(0);
            store.saveArticle(article.filtered("noise", BASE));

            Reply filtered = get("/api/articles?status=filtered");

            assertEquals(1, filtered.body().path("total").asInt());
            assertEquals(2, store.countArticles(ArticleStatus.PENDING));
        }

        @Test
        @DisplayName("Should accept a processing request and report no run to cancel afterwards")
        void processAndCancel() throws Exception {
            // When
            Reply accepted = post("/api/articles/process?limit=5", null);

            // Then
            assertEquals(202, accepted.code());
            assertEquals(DigestScheduler.PROCESS_TASK, accepted.body().path("task").path("name").asText());
            supervisor.find(DigestScheduler.PROCESS_TASK).orElseThrow().await(Duration.ofSeconds(5));
            assertEquals(404, post("/api/articles/process/cancel", null).code());
            assertEquals(400, post("/api/articles/process?limit=0", null).code());
        }
    }

    @Nested
    @DisplayName("Settings and status")
    class SettingsAndStatus {

        @Test
        @DisplayName("Should upsert settings")
        void settings() throws Exception {
            // When
            Reply saved = post("/api/config", "{\"llm_model\": \"gpt-test\", \"custom\": 5}");
            Reply all = get("/api/config");

            // Then
            assertEquals(2, saved.body().path("updated").asInt());
            assertEquals("gpt-test", all.body().path("llm_model").asText());
            assertEquals("5", all.body().path("custom").asText());
            assertEquals(400, post("/api/config", "[1, 2]").code());
        }

        @Test
        @DisplayName("Should report counts")
        void status() throws Exception {
            store.createSource("Tech", "https://feeds.example/tech", true);

            Reply status = get("/api/status");

            assertEquals(200, status.code());
            assertEquals(1, status.body().path("sources").path("total").asInt());
            assertEquals(0, status.body().path("articles").path("total").asInt());
        }

        @Test
        @DisplayName("Should fail the connection test without an API key")
        void modelTestUnconfigured() throws Exception {
            Reply reply = post("/api/llm/test", null);

            assertEquals(400, reply.code());
            assertFalse(reply.body().path("success").asBoolean());
        }

        @Test
        @DisplayName("Should reject wrong methods")
        void methodNotAllowed() throws Exception {
            assertEquals(405, call("DELETE", "/api/status", null).code());
            assertEquals(405, get("/api/llm/test").code());
        }
    }
}

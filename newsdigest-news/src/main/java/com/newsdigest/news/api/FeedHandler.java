package com.newsdigest.news.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsdigest.news.fetch.FeedFetchException;
import com.newsdigest.news.fetch.FeedIngestionService;
import com.newsdigest.news.fetch.IngestionSummary;
import com.newsdigest.news.model.Source;
import com.newsdigest.news.scheduler.DigestScheduler;
import com.newsdigest.news.store.NewsStore;
import com.newsdigest.news.task.CancellationToken;
import com.newsdigest.news.task.CancelledException;
import com.newsdigest.news.task.TrackedTask;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * Handlers for feed sources.
 *
 * <pre>
 *   GET    /api/feeds
 *   POST   /api/feeds              {"name", "url", "enabled"?}
 *   POST   /api/feeds/fetch        fetch all enabled sources in the background
 *   DELETE /api/feeds/{id}
 *   POST   /api/feeds/{id}/fetch   fetch one source now
 * </pre>
 */
public class FeedHandler extends ApiHandlerBase {

    private static final Logger log = LoggerFactory.getLogger(FeedHandler.class);

    private final NewsStore store;
    private final FeedIngestionService ingestion;
    private final DigestScheduler scheduler;

    public FeedHandler(NewsStore store, FeedIngestionService ingestion, DigestScheduler scheduler) {
        this.store = store;
        this.ingestion = ingestion;
        this.scheduler = scheduler;
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;

        String[] parts = pathParts(exchange);
        // ["", "api", "feeds", ...]
        if (parts.length == 3) {
            String method = exchange.getRequestMethod().toUpperCase();
            switch (method) {
                case "GET" -> handleList(exchange);
                case "POST" -> handleCreate(exchange);
                default -> sendError(exchange, 405, "Method not allowed");
            }
            return;
        }

        if (parts.length == 4 && "fetch".equals(parts[3])) {
            if (!checkMethod(exchange, "POST")) return;
            handleFetchAll(exchange);
            return;
        }

        OptionalLong id = parseId(parts[3]);
        if (id.isEmpty()) {
            sendError(exchange, 400, "Invalid feed id: " + parts[3]);
            return;
        }

        if (parts.length == 4) {
            if (!checkMethod(exchange, "DELETE")) return;
            handleDelete(exchange, id.getAsLong());
        } else if (parts.length == 5 && "fetch".equals(parts[4])) {
            if (!checkMethod(exchange, "POST")) return;
            handleFetchOne(exchange, id.getAsLong());
        } else {
            sendError(exchange, 404, "Not found");
        }
    }

    private void handleList(HttpExchange exchange) throws IOException {
        sendObject(exchange, 200, store.listSources());
    }

    private void handleCreate(HttpExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;

        String name = body.path("name").asText("").trim();
        String url = body.path("url").asText("").trim();
        boolean enabled = body.path("enabled").asBoolean(true);

        if (name.isEmpty() || url.isEmpty()) {
            sendError(exchange, 400, "Both name and url are required");
            return;
        }
        if (store.findSourceByUrl(url).isPresent()) {
            sendError(exchange, 409, "Feed already exists: " + url);
            return;
        }

        Source source = store.createSource(name, url, enabled);
        sendObject(exchange, 201, source);
    }

    private void handleDelete(HttpExchange exchange, long id) throws IOException {
        if (!store.deleteSource(id)) {
            sendError(exchange, 404, "Feed not found: " + id);
            return;
        }
        log.info("Deleted source {}", id);
        ObjectNode json = mapper.createObjectNode();
        json.put("message", "deleted");
        sendJson(exchange, 200, json);
    }

    private void handleFetchOne(HttpExchange exchange, long id) throws IOException {
        try {
            int created = ingestion.fetchSource(id, CancellationToken.none());
            ObjectNode json = mapper.createObjectNode();
            json.put("new_articles", created);
            sendJson(exchange, 200, json);
        } catch (IllegalArgumentException e) {
            sendError(exchange, 404, e.getMessage());
        } catch (FeedFetchException e) {
            sendError(exchange, 502, e.getMessage());
        } catch (CancelledException e) {
            sendError(exchange, 503, e.getMessage());
        }
    }

    private void handleFetchAll(HttpExchange exchange) throws IOException {
        TrackedTask<IngestionSummary> task = scheduler.triggerFetch();
        ObjectNode json = mapper.createObjectNode();
        json.put("message", "fetch started in background");
        json.set("task", taskJson(task));
        sendJson(exchange, 202, json);
    }
}

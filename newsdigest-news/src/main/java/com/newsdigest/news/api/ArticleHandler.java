package com.newsdigest.news.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsdigest.news.model.Article;
import com.newsdigest.news.model.ArticleStatus;
import com.newsdigest.news.process.ProcessingStats;
import com.newsdigest.news.scheduler.DigestScheduler;
import com.newsdigest.news.store.ArticleQuery;
import com.newsdigest.news.store.NewsStore;
import com.newsdigest.news.task.TaskSupervisor;
import com.newsdigest.news.task.TrackedTask;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Handlers for articles and manual processing.
 *
 * <pre>
 *   GET    /api/articles?status=pending&amp;page=1
 *   DELETE /api/articles/{id}
 *   POST   /api/articles/process?limit=10
 *   POST   /api/articles/process/cancel
 * </pre>
 */
public class ArticleHandler extends ApiHandlerBase {

    public static final int PAGE_SIZE = 20;
    public static final int DEFAULT_PROCESS_BATCH = 10;

    private final NewsStore store;
    private final DigestScheduler scheduler;
    private final TaskSupervisor supervisor;

    public ArticleHandler(NewsStore store, DigestScheduler scheduler, TaskSupervisor supervisor) {
        this.store = store;
        this.scheduler = scheduler;
        this.supervisor = supervisor;
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;

        String[] parts = pathParts(exchange);
        // ["", "api", "articles", ...]
        if (parts.length == 3) {
            if (!checkMethod(exchange, "GET")) return;
            handleList(exchange);
            return;
        }

        if ("process".equals(parts[3])) {
            if (!checkMethod(exchange, "POST")) return;
            if (parts.length == 4) {
                handleProcess(exchange);
            } else if (parts.length == 5 && "cancel".equals(parts[4])) {
                handleCancel(exchange);
            } else {
                sendError(exchange, 404, "Not found");
            }
            return;
        }

        OptionalLong id = parseId(parts[3]);
        if (id.isEmpty() || parts.length != 4) {
            sendError(exchange, 404, "Not found");
            return;
        }
        if (!checkMethod(exchange, "DELETE")) return;
        if (!store.deleteArticle(id.getAsLong())) {
            sendError(exchange, 404, "Article not found: " + id.getAsLong());
            return;
        }
        ObjectNode json = mapper.createObjectNode();
        json.put("message", "deleted");
        sendJson(exchange, 200, json);
    }

    private void handleList(HttpExchange exchange) throws IOException {
        Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
        ArticleStatus status = ArticleStatus.parse(params.get("status")).orElse(null);
        int page = Math.max(1, intParam(params, "page", 1));

        List<Article> articles = store.findArticles(ArticleQuery.page(status, page, PAGE_SIZE));
        int total = store.countArticles(status);

        ObjectNode json = mapper.createObjectNode();
        json.set("data", mapper.valueToTree(articles));
        json.put("total", total);
        json.put("page", page);
        sendJson(exchange, 200, json);
    }

    private void handleProcess(HttpExchange exchange) throws IOException {
        Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
        int limit = intParam(params, "limit", DEFAULT_PROCESS_BATCH);
        if (limit < 1) {
            sendError(exchange, 400, "limit must be positive");
            return;
        }

        TrackedTask<ProcessingStats> task = scheduler.triggerProcess(limit);
        ObjectNode json = mapper.createObjectNode();
        json.put("message", "processing started in background");
        json.set("task", taskJson(task));
        sendJson(exchange, 202, json);
    }

    private void handleCancel(HttpExchange exchange) throws IOException {
        if (!supervisor.cancel(DigestScheduler.PROCESS_TASK)) {
            sendError(exchange, 404, "No processing run in progress");
            return;
        }
        ObjectNode json = mapper.createObjectNode();
        json.put("message", "cancellation requested");
        sendJson(exchange, 200, json);
    }
}

package com.newsdigest.news.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON API server.
 *
 * Endpoints:
 *   GET    /api/feeds                  - List feed sources
 *   POST   /api/feeds                  - Add a feed source
 *   POST   /api/feeds/fetch            - Fetch all enabled sources (background)
 *   DELETE /api/feeds/{id}             - Remove a feed source
 *   POST   /api/feeds/{id}/fetch       - Fetch one source now
 *   GET    /api/articles               - Paged article list, optional status filter
 *   DELETE /api/articles/{id}          - Remove an article
 *   POST   /api/articles/process       - Process pending articles (background)
 *   POST   /api/articles/process/cancel - Cancel the running processing run
 *   GET    /api/config                 - All settings
 *   POST   /api/config                 - Upsert settings
 *   GET    /api/llm/models             - Models offered by the configured endpoint
 *   POST   /api/llm/test               - Live connection test
 *   GET    /api/status                 - Counts and next scheduled runs
 *   GET    /api/tasks                  - Background task states
 */
public class DigestApiServer {

    private static final Logger log = LoggerFactory.getLogger(DigestApiServer.class);

    private final int port;
    private final FeedHandler feedHandler;
    private final ArticleHandler articleHandler;
    private final SettingsHandler settingsHandler;
    private final ModelHandler modelHandler;
    private final StatusHandler statusHandler;

    private HttpServer server;
    private ExecutorService executor;

    public DigestApiServer(int port,
                           FeedHandler feedHandler,
                           ArticleHandler articleHandler,
                           SettingsHandler settingsHandler,
                           ModelHandler modelHandler,
                           StatusHandler statusHandler) {
        this.port = port;
        this.feedHandler = feedHandler;
        this.articleHandler = articleHandler;
        this.settingsHandler = settingsHandler;
        this.modelHandler = modelHandler;
        this.statusHandler = statusHandler;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "digest-api-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/api/feeds", guarded(feedHandler::handle));
        server.createContext("/api/articles", guarded(articleHandler::handle));
        server.createContext("/api/config", guarded(settingsHandler::handle));
        server.createContext("/api/llm/models", guarded(modelHandler::handleModels));
        server.createContext("/api/llm/test", guarded(modelHandler::handleTest));
        server.createContext("/api/status", guarded(statusHandler::handleStatus));
        server.createContext("/api/tasks", guarded(statusHandler::handleTasks));

        server.start();
        log.info("API server started on http://localhost:{}", getPort());
    }

    /**
     * Turn unexpected runtime errors into a 500 JSON reply instead of a dropped connection.
     */
    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                log.error("Unhandled error on {} {}: {}", exchange.getRequestMethod(),
                    exchange.getRequestURI(), e.getMessage(), e);
                sendInternalError(exchange, e);
            } finally {
                exchange.close();
            }
        };
    }

    private void sendInternalError(HttpExchange exchange, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        byte[] bytes = ("{\"error\":\"" + escape(message) + "\"}").getBytes(StandardCharsets.UTF_8);
        try {
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(500, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } catch (IOException | RuntimeException ioe) {
            // Headers were already sent; the connection is closed by the caller
            log.debug("Could not send error response: {}", ioe.getMessage());
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            log.info("API server stopped");
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}

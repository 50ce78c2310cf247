package com.newsdigest.news.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsdigest.news.store.NewsStore;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET and POST /api/config. POST upserts every key in the body; the last write wins.
 */
public class SettingsHandler extends ApiHandlerBase {

    private static final Logger log = LoggerFactory.getLogger(SettingsHandler.class);

    private final NewsStore store;

    public SettingsHandler(NewsStore store) {
        this.store = store;
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;

        switch (exchange.getRequestMethod().toUpperCase()) {
            case "GET" -> sendObject(exchange, 200, store.loadSettings());
            case "POST" -> handleUpdate(exchange);
            default -> sendError(exchange, 405, "Method not allowed");
        }
    }

    private void handleUpdate(HttpExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;
        if (!body.isObject()) {
            sendError(exchange, 400, "Expected a JSON object of key/value pairs");
            return;
        }

        Map<String, String> updates = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isContainerNode()) {
                sendError(exchange, 400, "Value of " + field.getKey() + " must be a string");
                return;
            }
            updates.put(field.getKey(), value.isNull() ? "" : value.asText());
        }

        updates.forEach(store::putSetting);
        log.info("Updated settings: {}", updates.keySet());

        ObjectNode json = mapper.createObjectNode();
        json.put("message", "saved");
        json.put("updated", updates.size());
        sendJson(exchange, 200, json);
    }
}

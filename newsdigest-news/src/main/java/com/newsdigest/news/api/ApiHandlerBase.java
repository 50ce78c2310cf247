package com.newsdigest.news.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newsdigest.news.task.TrackedTask;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Base class for API handlers with shared utility methods.
 */
public abstract class ApiHandlerBase {

    protected static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    protected Map<String, String> parseQuery(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) return params;

        for (String param : query.split("&")) {
            String[] parts = param.split("=", 2);
            if (parts.length == 2) {
                String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
                String value = URLDecoder.decode(parts[1], StandardCharsets.UTF_8);
                params.put(key, value);
            }
        }
        return params;
    }

    protected int intParam(Map<String, String> params, String name, int defaultValue) {
        String value = params.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    protected boolean checkMethod(HttpExchange exchange, String expected) throws IOException {
        if (!exchange.getRequestMethod().equalsIgnoreCase(expected)) {
            sendError(exchange, 405, "Method not allowed");
            return false;
        }
        return true;
    }

    protected void sendJson(HttpExchange exchange, int status, ObjectNode json) throws IOException {
        sendObject(exchange, status, json);
    }

    protected void sendObject(HttpExchange exchange, int status, Object obj) throws IOException {
        byte[] response = mapper.writeValueAsBytes(obj);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    protected void sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode error = mapper.createObjectNode();
        error.put("error", message);
        sendJson(exchange, status, error);
    }

    /**
     * @return the parsed body, or null after a 400 was sent for malformed JSON
     */
    protected JsonNode readJsonBody(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                sendError(exchange, 400, "Request body is empty");
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "Invalid JSON: " + e.getOriginalMessage());
            return null;
        }
    }

    protected String[] pathParts(HttpExchange exchange) {
        String path = exchange.getRequestURI().getPath();
        return path.split("/");
    }

    protected OptionalLong parseId(String value) {
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    protected ObjectNode taskJson(TrackedTask<?> task) {
        ObjectNode json = mapper.createObjectNode();
        json.put("name", task.getName());
        json.put("state", task.getState().name());
        json.put("startedAt", task.getStartedAt().toString());
        if (task.getFinishedAt() != null) {
            json.put("finishedAt", task.getFinishedAt().toString());
        }
        json.put("cancelRequested", task.isCancelRequested());
        task.getFailure().ifPresent(error -> json.put("error", error.getMessage()));
        return json;
    }

    protected boolean handleCors(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            return true;
        }
        return false;
    }
}

package com.newsdigest.news.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsdigest.ai.HttpModelGateway;
import com.newsdigest.ai.ModelException;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.List;

/**
 * GET /api/llm/models and POST /api/llm/test.
 */
public class ModelHandler extends ApiHandlerBase {

    private final HttpModelGateway gateway;

    public ModelHandler(HttpModelGateway gateway) {
        this.gateway = gateway;
    }

    public void handleModels(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!checkMethod(exchange, "GET")) return;

        try {
            List<String> models = gateway.listModels();
            ObjectNode json = mapper.createObjectNode();
            json.set("models", mapper.valueToTree(models));
            sendJson(exchange, 200, json);
        } catch (ModelException e) {
            sendError(exchange, statusFor(e), e.getMessage());
        }
    }

    public void handleTest(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!checkMethod(exchange, "POST")) return;

        ObjectNode json = mapper.createObjectNode();
        try {
            String reply = gateway.testConnection();
            json.put("success", true);
            json.put("response", reply);
            sendJson(exchange, 200, json);
        } catch (ModelException e) {
            json.put("success", false);
            json.put("error", e.getMessage());
            sendJson(exchange, statusFor(e), json);
        }
    }

    private static int statusFor(ModelException e) {
        return e.getType() == ModelException.ErrorType.CONFIGURATION ? 400 : 502;
    }
}

package com.newsdigest.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Google generative-content API (Gemini).
 *
 * <pre>
 * POST {base}/v1beta/models/{model}:generateContent?key={key}
 * {"systemInstruction": {"parts": [{"text": ...}]},
 *  "contents": [{"role": "user", "parts": [{"text": ...}]}]}
 * </pre>
 *
 * The system instruction is left out entirely when the system prompt is empty.
 */
public class GenerativeContentAdapter implements ProviderAdapter {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public String name() {
        return "generative-content";
    }

    @Override
    public Request buildChatRequest(ProviderSettings settings, String systemPrompt, String userContent)
            throws ModelException {
        HttpUrl base = HttpUrl.parse(settings.apiUrl() + "/v1beta/models/" + settings.model() + ":generateContent");
        if (base == null) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION,
                "Invalid API URL: " + settings.apiUrl());
        }
        HttpUrl url = base.newBuilder()
            .addQueryParameter("key", settings.apiKey())
            .build();

        ObjectNode body = JSON.createObjectNode();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            body.putObject("systemInstruction")
                .putArray("parts")
                .addObject().put("text", systemPrompt);
        }
        ObjectNode userTurn = body.putArray("contents").addObject();
        userTurn.put("role", "user");
        userTurn.putArray("parts").addObject().put("text", userContent == null ? "" : userContent);

        return new Request.Builder()
            .url(url)
            .post(RequestBody.create(ChatCompletionsAdapter.write(body), JSON_MEDIA))
            .build();
    }

    @Override
    public String extractReply(JsonNode root) throws ModelException {
        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            throw new ModelException(ModelException.ErrorType.EMPTY_RESPONSE, "no response from model");
        }
        JsonNode parts = candidates.get(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty() || !parts.get(0).path("text").isTextual()) {
            throw new ModelException(ModelException.ErrorType.EMPTY_RESPONSE, "no response from model");
        }
        return parts.get(0).path("text").asText();
    }
}

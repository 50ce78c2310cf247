package com.newsdigest.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * OpenAI-style chat completions. Also spoken by Ollama, DeepSeek, vLLM and most proxies.
 *
 * <pre>
 * POST {base}/chat/completions
 * Authorization: Bearer {key}
 * {"model": ..., "messages": [{"role": "system", ...}, {"role": "user", ...}]}
 * </pre>
 */
public class ChatCompletionsAdapter implements ProviderAdapter {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public String name() {
        return "chat-completions";
    }

    @Override
    public Request buildChatRequest(ProviderSettings settings, String systemPrompt, String userContent)
            throws ModelException {
        HttpUrl url = HttpUrl.parse(settings.apiUrl() + "/chat/completions");
        if (url == null) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION,
                "Invalid API URL: " + settings.apiUrl());
        }

        ObjectNode body = JSON.createObjectNode();
        body.put("model", settings.model());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt == null ? "" : systemPrompt);
        messages.addObject().put("role", "user").put("content", userContent == null ? "" : userContent);

        Request.Builder request = new Request.Builder()
            .url(url)
            .post(RequestBody.create(write(body), JSON_MEDIA));
        if (settings.hasApiKey()) {
            request.header("Authorization", "Bearer " + settings.apiKey());
        }
        return request.build();
    }

    @Override
    public String extractReply(JsonNode root) throws ModelException {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ModelException(ModelException.ErrorType.EMPTY_RESPONSE, "no response from model");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ModelException(ModelException.ErrorType.EMPTY_RESPONSE, "no response from model");
        }
        return content.asText();
    }

    static String write(ObjectNode body) throws ModelException {
        try {
            return JSON.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ModelException(ModelException.ErrorType.DECODE,
                "Failed to encode request: " + e.getOriginalMessage(), e);
        }
    }
}

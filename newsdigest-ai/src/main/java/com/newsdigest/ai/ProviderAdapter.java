package com.newsdigest.ai;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.MediaType;
import okhttp3.Request;

/**
 * Translates a chat call into one provider's wire format and back.
 */
public interface ProviderAdapter {

    MediaType JSON_MEDIA = MediaType.get("application/json; charset=utf-8");

    /**
     * Human readable name used in logs and error messages.
     */
    String name();

    Request buildChatRequest(ProviderSettings settings, String systemPrompt, String userContent)
        throws ModelException;

    /**
     * Pull the reply text out of a decoded 2xx response body.
     */
    String extractReply(JsonNode root) throws ModelException;
}

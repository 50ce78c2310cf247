package com.newsdigest.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Model gateway over HTTP. Settings are read from the {@link SettingsSource} on every call
 * and the wire format is picked by provider id through the {@link ProviderRegistry}.
 */
public class HttpModelGateway implements ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpModelGateway.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_BODY_IN_ERROR = 500;

    private final SettingsSource settingsSource;
    private final ProviderRegistry providers;
    private final OkHttpClient httpClient;

    public HttpModelGateway(SettingsSource settingsSource, ProviderRegistry providers, OkHttpClient httpClient) {
        this.settingsSource = settingsSource;
        this.providers = providers;
        this.httpClient = httpClient;
    }

    public HttpModelGateway(SettingsSource settingsSource, Duration connectTimeout, Duration callTimeout) {
        this(settingsSource, ProviderRegistry.defaults(), createClient(connectTimeout, callTimeout));
    }

    /**
     * HTTP client whose call timeout bounds every model call end to end.
     */
    public static OkHttpClient createClient(Duration connectTimeout, Duration callTimeout) {
        return new OkHttpClient.Builder()
            .connectTimeout(connectTimeout)
            .readTimeout(callTimeout)
            .writeTimeout(callTimeout)
            .callTimeout(callTimeout)
            .build();
    }

    // ==================== Chat ====================

    @Override
    public String chat(String systemPrompt, String userContent) throws ModelException {
        ProviderSettings settings = currentSettings().requireEndpoint();
        ProviderAdapter adapter = providers.lookup(settings.provider());

        Request request = adapter.buildChatRequest(settings, systemPrompt, userContent);
        log.debug("Model call via {} ({}): {}", adapter.name(), settings.model(), truncate(userContent, 100));

        String body = execute(request, adapter.name());
        JsonNode root = parse(body);
        String reply = adapter.extractReply(root);

        log.debug("Model reply ({} chars): {}", reply.length(), truncate(reply, 200));
        return reply;
    }

    // ==================== Models ====================

    /**
     * List model ids offered by a chat-completions style endpoint ({@code GET {base}/models}).
     */
    public List<String> listModels() throws ModelException {
        ProviderSettings settings = currentSettings();
        if (settings.apiUrl().isEmpty()) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION, "API URL is not configured");
        }
        HttpUrl url = HttpUrl.parse(settings.apiUrl() + "/models");
        if (url == null) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION,
                "Invalid API URL: " + settings.apiUrl());
        }

        Request.Builder request = new Request.Builder().url(url).get();
        if (settings.hasApiKey()) {
            request.header("Authorization", "Bearer " + settings.apiKey());
        }

        JsonNode root = parse(execute(request.build(), "models"));
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new ModelException(ModelException.ErrorType.DECODE,
                "Unexpected models response: " + truncate(root.toString(), MAX_BODY_IN_ERROR));
        }

        List<String> models = new ArrayList<>();
        for (JsonNode entry : data) {
            String id = entry.path("id").asText("");
            if (!id.isEmpty()) {
                models.add(id);
            }
        }
        log.info("Listed {} models from {}", models.size(), settings.apiUrl());
        return models;
    }

    // ==================== Connection test ====================

    /**
     * Validate URL, key and model, then do one live round trip.
     *
     * @return the model's reply to a trivial prompt
     */
    public String testConnection() throws ModelException {
        ProviderSettings settings = currentSettings().requireComplete();
        log.info("Testing model connection: {}", settings);
        return chat("", "Hi");
    }

    // ==================== Helpers ====================

    private ProviderSettings currentSettings() {
        return ProviderSettings.from(settingsSource.loadSettings());
    }

    private String execute(Request request, String label) throws ModelException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";

            if (!response.isSuccessful()) {
                log.warn("Model API {} returned HTTP {}", label, response.code());
                throw new ModelException(ModelException.ErrorType.HTTP_STATUS,
                    "Model API returned HTTP " + response.code() + ": " + truncate(body, MAX_BODY_IN_ERROR));
            }
            return body;
        } catch (InterruptedIOException e) {
            throw new ModelException(ModelException.ErrorType.TRANSPORT,
                "Model API call timed out: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ModelException(ModelException.ErrorType.TRANSPORT,
                "Model API request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body) throws ModelException {
        try {
            JsonNode root = JSON.readTree(body);
            if (root == null || root.isMissingNode()) {
                throw new ModelException(ModelException.ErrorType.DECODE, "Empty response body");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ModelException(ModelException.ErrorType.DECODE,
                "Failed to parse response: " + e.getOriginalMessage() + " (body: " + truncate(body, MAX_BODY_IN_ERROR) + ")", e);
        }
    }

    static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}

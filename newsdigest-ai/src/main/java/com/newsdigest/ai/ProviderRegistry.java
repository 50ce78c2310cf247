package com.newsdigest.ai;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps provider ids to wire adapters. Unknown ids fall back to the default adapter,
 * so any OpenAI-compatible endpoint works without registration.
 */
public class ProviderRegistry {

    public static final String GOOGLE = "google";

    private final Map<String, ProviderAdapter> adapters = new ConcurrentHashMap<>();
    private final ProviderAdapter defaultAdapter;

    public ProviderRegistry(ProviderAdapter defaultAdapter) {
        this.defaultAdapter = defaultAdapter;
    }

    /**
     * Registry with the built-in formats: chat completions as default, generative content for "google".
     */
    public static ProviderRegistry defaults() {
        ChatCompletionsAdapter chat = new ChatCompletionsAdapter();
        return new ProviderRegistry(chat)
            .register(ProviderSettings.DEFAULT_PROVIDER, chat)
            .register(GOOGLE, new GenerativeContentAdapter());
    }

    public ProviderRegistry register(String providerId, ProviderAdapter adapter) {
        adapters.put(providerId.toLowerCase(), adapter);
        return this;
    }

    public ProviderAdapter lookup(String providerId) {
        if (providerId == null) return defaultAdapter;
        return adapters.getOrDefault(providerId.toLowerCase(), defaultAdapter);
    }

    public Set<String> getRegisteredIds() {
        return Set.copyOf(adapters.keySet());
    }
}

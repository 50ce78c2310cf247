package com.newsdigest.ai;

import java.util.Map;

/**
 * Connection settings for one model call, read from the settings map.
 */
public record ProviderSettings(
    String provider,
    String apiUrl,
    String apiKey,
    String model
) {
    public static final String DEFAULT_PROVIDER = "openai";

    public ProviderSettings {
        provider = provider == null || provider.isBlank() ? DEFAULT_PROVIDER : provider.trim().toLowerCase();
        apiUrl = stripTrailingSlash(apiUrl == null ? "" : apiUrl.trim());
        apiKey = apiKey == null ? "" : apiKey.trim();
        model = model == null ? "" : model.trim();
    }

    public static ProviderSettings from(Map<String, String> settings) {
        return new ProviderSettings(
            settings.get(SettingKeys.PROVIDER),
            settings.get(SettingKeys.API_URL),
            settings.get(SettingKeys.API_KEY),
            settings.get(SettingKeys.MODEL)
        );
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    /**
     * Checks that URL, key and model are all set.
     *
     * @throws ModelException of type CONFIGURATION naming the first missing field
     */
    public ProviderSettings requireComplete() throws ModelException {
        if (apiUrl.isEmpty()) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION, "API URL is not configured");
        }
        if (apiKey.isEmpty()) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION, "API key is not configured");
        }
        if (model.isEmpty()) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION, "model is not configured");
        }
        return this;
    }

    /**
     * Checks the fields a chat call cannot do without. The key may be empty for local servers.
     */
    public ProviderSettings requireEndpoint() throws ModelException {
        if (apiUrl.isEmpty()) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION, "API URL is not configured");
        }
        if (model.isEmpty()) {
            throw new ModelException(ModelException.ErrorType.CONFIGURATION, "model is not configured");
        }
        return this;
    }

    @Override
    public String toString() {
        // Never print the key
        return "ProviderSettings[provider=" + provider + ", apiUrl=" + apiUrl + ", model=" + model + "]";
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}

package com.newsdigest.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderSettingsTest {

    @Test
    @DisplayName("Should default the provider and strip trailing slashes")
    void normalizesValues() {
        // When
        ProviderSettings settings = ProviderSettings.from(Map.of(
            SettingKeys.API_URL, "https://api.openai.com/v1/",
            SettingKeys.MODEL, " gpt-4o-mini "
        ));

        // Then
        assertEquals("openai", settings.provider());
        assertEquals("https://api.openai.com/v1", settings.apiUrl());
        assertEquals("gpt-4o-mini", settings.model());
        assertFalse(settings.hasApiKey());
    }

    @Test
    @DisplayName("Should name the first missing field")
    void requireCompleteNamesMissingField() {
        ProviderSettings noUrl = new ProviderSettings("openai", "", "k", "m");
        ProviderSettings noModel = new ProviderSettings("openai", "http://x", "k", "");

        ModelException urlError = assertThrows(ModelException.class, noUrl::requireComplete);
        ModelException modelError = assertThrows(ModelException.class, noModel::requireComplete);

        assertEquals("API URL is not configured", urlError.getMessage());
        assertEquals("model is not configured", modelError.getMessage());
    }

    @Test
    @DisplayName("Should not print the API key")
    void toStringHidesKey() {
        ProviderSettings settings = new ProviderSettings("google", "http://x", "secret-key", "m");

        assertFalse(settings.toString().contains("secret-key"));
    }
}

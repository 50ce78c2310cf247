package com.newsdigest.ai;

import java.util.Map;

/**
 * Supplies the current settings. Implementations are queried on every model call,
 * so edits take effect without a restart.
 */
@FunctionalInterface
public interface SettingsSource {

    Map<String, String> loadSettings();

    default String get(String key, String defaultValue) {
        String value = loadSettings().get(key);
        return value != null ? value : defaultValue;
    }
}

package com.newsdigest.news.process;

import com.newsdigest.ai.ProviderSettings;
import com.newsdigest.ai.SettingKeys;
import com.newsdigest.news.store.NewsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings written on first start. Existing values are never overwritten.
 */
public final class DefaultSettings {

    private static final Logger log = LoggerFactory.getLogger(DefaultSettings.class);

    public static final String API_URL = "https://api.openai.com/v1";
    public static final String MODEL = "gpt-4o-mini";

    public static final String FILTER_PROMPT = """
        You are a news screening assistant. Decide whether the following article is worth reading.
        Reply in JSON: {"worth": true/false, "reason": "short explanation"}
        Only significant technology news and industry developments are worth reading; \
        advertisements, job postings and meaningless content are not worth reading.""";

    public static final String SUMMARY_PROMPT = """
        Summarize the core content of the following article:
        1. Keep it under 200 words
        2. Highlight the key information
        3. Use concise, plain language""";

    private DefaultSettings() {
    }

    public static Map<String, String> values() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(SettingKeys.PROVIDER, ProviderSettings.DEFAULT_PROVIDER);
        defaults.put(SettingKeys.API_URL, API_URL);
        defaults.put(SettingKeys.MODEL, MODEL);
        defaults.put(SettingKeys.PROMPT_FILTER, FILTER_PROMPT);
        defaults.put(SettingKeys.PROMPT_SUMMARY, SUMMARY_PROMPT);
        defaults.put(SettingKeys.FILTER_REJECT_MARKER, FilterVerdictParser.DEFAULT_REJECT_MARKER);
        return defaults;
    }

    public static void seed(NewsStore store) {
        values().forEach(store::putSettingIfAbsent);
        log.info("Default settings seeded ({} keys)", values().size());
    }
}

package com.newsdigest.ai;

/**
 * Keys of the flat settings map that configure the model gateway and the prompts.
 */
public final class SettingKeys {

    public static final String PROVIDER = "llm_provider";
    public static final String API_URL = "llm_api_url";
    public static final String API_KEY = "llm_api_key";
    public static final String MODEL = "llm_model";

    public static final String PROMPT_FILTER = "prompt_filter";
    public static final String PROMPT_SUMMARY = "prompt_summary";
    public static final String FILTER_REJECT_MARKER = "filter_reject_marker";

    private SettingKeys() {
    }
}

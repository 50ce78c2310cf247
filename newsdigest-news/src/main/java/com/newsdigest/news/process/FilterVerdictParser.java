package com.newsdigest.news.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Decodes the model's filter reply. The whole reply must be a JSON object {@code {"worth": bool, "reason": "..."}};
 * a missing or null {@code worth} reads as false. Replies that are not such an object (prose, markdown fences,
 * a non-boolean {@code worth}) fall back to a substring heuristic, so this never throws.
 */
public class FilterVerdictParser {

    private static final Logger log = LoggerFactory.getLogger(FilterVerdictParser.class);

    public static final String DEFAULT_REJECT_MARKER = "not worth";

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public FilterVerdict parse(String reply, String rejectMarker) {
        if (reply == null || reply.isBlank()) {
            return fallback("", rejectMarker);
        }

        try {
            JsonNode root = JSON.readTree(reply);
            if (root.isNull()) {
                return new FilterVerdict(false, "");
            }
            if (root.isObject()) {
                JsonNode worth = root.path("worth");
                JsonNode reason = root.path("reason");
                boolean worthOk = worth.isMissingNode() || worth.isNull() || worth.isBoolean();
                boolean reasonOk = reason.isMissingNode() || reason.isNull() || reason.isTextual();
                if (worthOk && reasonOk) {
                    return new FilterVerdict(worth.asBoolean(false), reason.asText(""));
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Filter reply is not valid JSON, using heuristic: {}", e.getOriginalMessage());
        }
        return fallback(reply, rejectMarker);
    }

    /**
     * Not worth reading if the reply mentions the reject marker or the token "no" anywhere.
     * Matching is a plain substring test, so "know" or "note" also count.
     */
    FilterVerdict fallback(String reply, String rejectMarker) {
        String lower = reply.toLowerCase(Locale.ROOT);
        String marker = rejectMarker == null || rejectMarker.isBlank()
            ? DEFAULT_REJECT_MARKER
            : rejectMarker.toLowerCase(Locale.ROOT);
        boolean rejected = lower.contains(marker) || lower.contains("no");
        return new FilterVerdict(!rejected, "");
    }
}

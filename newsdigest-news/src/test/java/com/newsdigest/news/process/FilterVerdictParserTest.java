package com.newsdigest.news.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilterVerdictParserTest {

    private final FilterVerdictParser parser = new FilterVerdictParser();

    @Nested
    @DisplayName("JSON replies")
    class JsonReplies {

        @Test
        @DisplayName("Should decode a plain JSON verdict")
        void plainJson() {
            FilterVerdict verdict = parser.parse("{\"worth\": false, \"reason\": \"job posting\"}", "not worth");

            assertFalse(verdict.worth());
            assertEquals("job posting", verdict.reason());
        }

        @Test
        @DisplayName("Should read a missing worth field as not worth, keeping the reason")
        void missingWorth() {
            // Given
            String reply = "{\"reason\": \"advertisement\"}";

            // When
            FilterVerdict verdict = parser.parse(reply, "not worth");

            // Then
            assertFalse(verdict.worth());
            assertEquals("advertisement", verdict.reason());
        }

        @Test
        @DisplayName("Should read a null worth as not worth")
        void nullWorth() {
            assertFalse(parser.parse("{\"worth\": null, \"reason\": \"spam\"}", "not worth").worth());
            assertFalse(parser.parse("null", "not worth").worth());
        }

        @Test
        @DisplayName("Should treat a missing reason as empty")
        void missingReason() {
            FilterVerdict verdict = parser.parse("{\"worth\": true}", "not worth");

            assertTrue(verdict.worth());
            assertEquals("", verdict.reason());
        }
    }

    @Nested
    @DisplayName("Heuristic fallback")
    class Fallback {

        @Test
        @DisplayName("Should reject when the reply contains the marker")
        void markerRejects() {
            FilterVerdict verdict = parser.parse("This article is NOT WORTH reading.", "not worth");

            assertFalse(verdict.worth());
            assertEquals("", verdict.reason());
        }

        @Test
        @DisplayName("Should reject when the reply contains 'no' anywhere")
        void noSubstringRejects() {
            assertFalse(parser.parse("No.", "not worth").worth());
            assertFalse(parser.parse("I don't know", "not worth").worth());
        }

        @Test
        @DisplayName("Should accept other free text")
        void freeTextAccepts() {
            FilterVerdict verdict = parser.parse("Yes, definitely read this", "not worth");

            assertTrue(verdict.worth());
        }

        @Test
        @DisplayName("Should use a custom marker")
        void customMarker() {
            assertFalse(parser.parse("Verdict: skip", "skip").worth());
        }

        @Test
        @DisplayName("Should fall back when worth is not a boolean")
        void nonBooleanWorth() {
            assertTrue(parser.parse("{\"worth\": \"yes\"}", "not worth").worth());
            assertFalse(parser.parse("{\"worth\": \"nope\"}", "not worth").worth());
        }

        @Test
        @DisplayName("Should treat JSON wrapped in prose or a markdown fence as free text")
        void fencedJsonUsesHeuristic() {
            // Given
            String accepted = "Here is my answer:\n```json\n{\"worth\": false, \"reason\": \"spam\"}\n```";
            String rejected = "```json\n{\"worth\": true, \"reason\": \"not worth much\"}\n```";

            // When / Then
            FilterVerdict verdict = parser.parse(accepted, "not worth");
            assertTrue(verdict.worth());
            assertEquals("", verdict.reason());
            assertFalse(parser.parse(rejected, "not worth").worth());
        }

        @Test
        @DisplayName("Should fall back on trailing text after the JSON object")
        void trailingText() {
            assertTrue(parser.parse("{\"worth\": false} because it is fresh", "not worth").worth());
        }

        @Test
        @DisplayName("Should never throw on broken input")
        void neverThrows() {
            assertDoesNotThrow(() -> parser.parse("{\"worth\": tru", "not worth"));
            assertDoesNotThrow(() -> parser.parse(null, null));
            assertDoesNotThrow(() -> parser.parse("}{", ""));
        }
    }
}

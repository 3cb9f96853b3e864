package dev.sitesage.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmResponseParserTest {

    private LlmResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new LlmResponseParser(new ObjectMapper());
    }

    @Test
    @DisplayName("Should parse the requested JSON object")
    void shouldParseJson() {
        SummaryResponse response = parser.parse("""
                {"summary": "Solid page.", "suggestions": ["Add alt text", "Shorten title"]}
                """);

        assertThat(response.summary()).isEqualTo("Solid page.");
        assertThat(response.suggestions()).containsExactly("Add alt text", "Shorten title");
    }

    @Test
    @DisplayName("Should find JSON wrapped in markdown fences and prose")
    void shouldParseWrappedJson() {
        SummaryResponse response = parser.parse("""
                Here is my analysis:
                ```json
                {"summary": "Needs work.", "suggestions": ["Fix links"]}
                ```
                """);

        assertThat(response.summary()).isEqualTo("Needs work.");
        assertThat(response.suggestions()).containsExactly("Fix links");
    }

    @Test
    @DisplayName("Should fall back to line parsing for plain text answers")
    void shouldParseLines() {
        SummaryResponse response = parser.parse("""
                Summary: The page is mostly fine.
                It lacks a description.

                Suggestions:
                1. Add a meta description
                - Add alt text to images
                * Declare the page language
                """);

        assertThat(response.summary()).isEqualTo("The page is mostly fine. It lacks a description.");
        assertThat(response.suggestions()).containsExactly(
                "Add a meta description", "Add alt text to images", "Declare the page language");
    }

    @Test
    @DisplayName("Should reject empty answers and answers without a summary")
    void shouldRejectMissingSummary() {
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(SummarizationException.class)
                .extracting("reason").isEqualTo(SummarizationException.Reason.INVALID_RESPONSE);
        assertThatThrownBy(() -> parser.parse("1. Only a suggestion"))
                .isInstanceOf(SummarizationException.class)
                .extracting("reason").isEqualTo(SummarizationException.Reason.INVALID_RESPONSE);
    }

    @Test
    @DisplayName("Should recognise an upper-case suggestions heading under any default locale")
    void shouldParseHeadingIndependentOfLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            SummaryResponse response = parser.parse("""
                    The page is mostly fine.
                    SUGGESTIONS:
                    Add a meta description
                    """);

            assertThat(response.summary()).isEqualTo("The page is mostly fine.");
            assertThat(response.suggestions()).containsExactly("Add a meta description");
        } finally {
            Locale.setDefault(original);
        }
    }
}

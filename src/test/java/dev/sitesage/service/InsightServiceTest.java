package dev.sitesage.service;

import dev.sitesage.ai.InsightPromptBuilder;
import dev.sitesage.ai.SummarizationClient;
import dev.sitesage.ai.SummarizationException;
import dev.sitesage.ai.SummaryResponse;
import dev.sitesage.config.InsightConfig;
import dev.sitesage.config.ScoringConfig;
import dev.sitesage.metrics.AnalysisMetrics;
import dev.sitesage.model.Insights;
import dev.sitesage.model.PageSignals;
import dev.sitesage.model.Penalty;
import dev.sitesage.model.PenaltyType;
import dev.sitesage.model.ScoreBreakdown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InsightServiceTest {

    private static final String URL = "https://example.com";

    @Mock
    private SummarizationClient summarizationClient;

    @Mock
    private AnalysisMetrics metrics;

    private InsightService insightService;

    private final PageSignals signals = PageSignals.builder().url(URL).h1Tags(List.of("Welcome")).build();
    private final ScoreBreakdown scores = new ScoreBreakdown(90, null, 80.0, 90.0,
            List.of(new Penalty(PenaltyType.MISSING_META_DESCRIPTION, 10, "Missing meta description")));

    @BeforeEach
    void setUp() {
        InsightConfig config = new InsightConfig("gemini", Duration.ofSeconds(2), 3, 30, null);
        insightService = new InsightService(summarizationClient, new InsightPromptBuilder(config),
                new FallbackInsightGenerator(ScoringConfig.defaults()), config, metrics);
    }

    @Test
    @DisplayName("Should clean, limit and truncate AI suggestions")
    void shouldMapAiResponse() {
        when(summarizationClient.isEnabled()).thenReturn(true);
        when(summarizationClient.summarize(anyString(), any(Duration.class)))
                .thenReturn(new SummaryResponse("  Looks good.  ", List.of(
                        "  Add a meta description ", "", "   ",
                        "This suggestion is far longer than thirty characters",
                        "Third", "Fourth is dropped")));

        StepVerifier.create(insightService.summarize(URL, signals, scores))
                .assertNext(insights -> {
                    assertThat(insights.source()).isEqualTo(Insights.InsightSource.AI);
                    assertThat(insights.summary()).isEqualTo("Looks good.");
                    assertThat(insights.suggestions()).hasSize(3);
                    assertThat(insights.suggestions().get(0)).isEqualTo("Add a meta description");
                    assertThat(insights.suggestions().get(1)).hasSize(30).endsWith("...");
                    assertThat(insights.suggestions().get(2)).isEqualTo("Third");
                })
                .verifyComplete();

        verify(metrics).recordAiInsights();
    }

    @Test
    @DisplayName("Should fall back to rule-based insights when summarization fails")
    void shouldFallBackOnFailure() {
        when(summarizationClient.isEnabled()).thenReturn(true);
        when(summarizationClient.summarize(anyString(), any(Duration.class)))
                .thenThrow(new SummarizationException(SummarizationException.Reason.QUOTA, "quota exceeded"));

        StepVerifier.create(insightService.summarize(URL, signals, scores))
                .assertNext(insights -> {
                    assertThat(insights.source()).isEqualTo(Insights.InsightSource.RULES);
                    assertThat(insights.summary()).contains("Missing meta description");
                })
                .verifyComplete();

        verify(metrics).recordFallbackInsights();
    }

    @Test
    @DisplayName("Should fall back when the summary is blank")
    void shouldFallBackOnBlankSummary() {
        when(summarizationClient.isEnabled()).thenReturn(true);
        when(summarizationClient.summarize(anyString(), any(Duration.class)))
                .thenReturn(new SummaryResponse(" ", List.of("Something")));

        StepVerifier.create(insightService.summarize(URL, signals, scores))
                .assertNext(insights -> assertThat(insights.source()).isEqualTo(Insights.InsightSource.RULES))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fall back on unexpected errors")
    void shouldFallBackOnUnexpectedError() {
        when(summarizationClient.isEnabled()).thenReturn(true);
        when(summarizationClient.summarize(anyString(), any(Duration.class)))
                .thenThrow(new IllegalStateException("boom"));

        StepVerifier.create(insightService.summarize(URL, signals, scores))
                .assertNext(insights -> assertThat(insights.summary()).isNotBlank())
                .verifyComplete();
    }

    @Test
    @DisplayName("Should not call the client when summarization is disabled")
    void shouldSkipDisabledClient() {
        when(summarizationClient.isEnabled()).thenReturn(false);

        StepVerifier.create(insightService.summarize(URL, signals, scores))
                .assertNext(insights -> assertThat(insights.source()).isEqualTo(Insights.InsightSource.RULES))
                .verifyComplete();

        verify(summarizationClient, never()).summarize(anyString(), any(Duration.class));
        verify(metrics).recordFallbackInsights();
    }

    @Test
    @DisplayName("Should drop null suggestions")
    void shouldDropNullSuggestions() {
        List<String> suggestions = new ArrayList<>();
        suggestions.add(null);
        suggestions.add("Keep me");

        Insights insights = insightService.toInsights(new SummaryResponse("Fine", suggestions));

        assertThat(insights.suggestions()).containsExactly("Keep me");
    }
}

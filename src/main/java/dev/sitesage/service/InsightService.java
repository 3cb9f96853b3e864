package dev.sitesage.service;

import dev.sitesage.ai.InsightPromptBuilder;
import dev.sitesage.ai.SummarizationClient;
import dev.sitesage.ai.SummarizationException;
import dev.sitesage.ai.SummaryResponse;
import dev.sitesage.config.InsightConfig;
import dev.sitesage.metrics.AnalysisMetrics;
import dev.sitesage.model.Insights;
import dev.sitesage.model.PageSignals;
import dev.sitesage.model.ScoreBreakdown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;

/**
 * Service for producing page insights.
 * Asks the summarization service first and falls back to rule-based insights on any failure,
 * so insight generation never fails the analysis of a page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsightService {

    private static final String ELLIPSIS = "...";

    private final SummarizationClient summarizationClient;
    private final InsightPromptBuilder promptBuilder;
    private final FallbackInsightGenerator fallbackGenerator;
    private final InsightConfig insightConfig;
    private final AnalysisMetrics metrics;

    public Mono<Insights> summarize(String url, PageSignals signals, ScoreBreakdown scores) {
        if (!summarizationClient.isEnabled()) {
            metrics.recordFallbackInsights();
            return Mono.fromSupplier(() -> fallbackGenerator.generate(signals, scores));
        }

        String prompt = promptBuilder.build(url, signals, scores);

        return Mono.fromCallable(() -> summarizationClient.summarize(prompt, insightConfig.timeout()))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(insightConfig.timeout())
                .map(this::toInsights)
                .doOnNext(insights -> {
                    metrics.recordAiInsights();
                    log.debug("AI insights for {}: {} suggestions", url, insights.suggestions().size());
                })
                .onErrorResume(e -> {
                    log.warn("Summarization failed for {} ({}), using rule-based insights", url, describe(e));
                    metrics.recordFallbackInsights();
                    return Mono.fromSupplier(() -> fallbackGenerator.generate(signals, scores));
                });
    }

    Insights toInsights(SummaryResponse response) {
        if (response == null || response.summary() == null || response.summary().isBlank()) {
            throw new SummarizationException(SummarizationException.Reason.INVALID_RESPONSE,
                    "Summary is empty");
        }

        List<String> suggestions = response.suggestions().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .limit(insightConfig.maxSuggestions())
                .map(this::truncate)
                .toList();

        return new Insights(response.summary().trim(), suggestions, Insights.InsightSource.AI);
    }

    private String truncate(String suggestion) {
        int max = insightConfig.maxSuggestionLength();
        if (suggestion.length() <= max) {
            return suggestion;
        }
        return suggestion.substring(0, max - ELLIPSIS.length()).trim() + ELLIPSIS;
    }

    private static String describe(Throwable e) {
        if (e instanceof SummarizationException summarizationException) {
            return summarizationException.getReason() + ": " + e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}

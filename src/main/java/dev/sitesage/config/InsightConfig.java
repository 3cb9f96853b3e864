package dev.sitesage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Insight generation settings shared by every summarization provider.
 * Loaded from application.yml under 'analyzer.insights' prefix. Provider credentials live under
 * 'analyzer.insights.gemini' and 'analyzer.insights.openai' and are read by the provider beans.
 */
@ConfigurationProperties(prefix = "analyzer.insights")
public record InsightConfig(
        String provider,
        Duration timeout,
        Integer maxSuggestions,
        Integer maxSuggestionLength,
        Integer maxPromptChars) {

    public InsightConfig {
        provider = provider != null && !provider.isBlank() ? provider : "none";
        timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        maxSuggestions = maxSuggestions != null ? Math.max(0, maxSuggestions) : 10;
        maxSuggestionLength = maxSuggestionLength != null ? Math.max(20, maxSuggestionLength) : 300;
        maxPromptChars = maxPromptChars != null ? Math.max(500, maxPromptChars) : 4000;
    }

    public static InsightConfig defaults() {
        return new InsightConfig(null, null, null, null, null);
    }
}

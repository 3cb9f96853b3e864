package dev.sitesage.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Implementation of SummarizationClient that uses Google AI Studio (Gemini) REST API.
 * Uses simple API key authentication - no service account required.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "analyzer.insights.provider", havingValue = "gemini")
public class GeminiSummarizationClient implements SummarizationClient {

    private static final String PROVIDER = "Gemini";

    private final WebClient webClient;
    private final LlmResponseParser responseParser;
    private final String apiKey;
    private final String model;
    private final String geminiPath;

    public GeminiSummarizationClient(
            LlmResponseParser responseParser,
            @Value("${analyzer.insights.gemini.api-key:}") String apiKey,
            @Value("${analyzer.insights.gemini.model:gemini-flash-latest}") String model,
            @Value("${analyzer.insights.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${analyzer.insights.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath) {
        this.responseParser = responseParser;
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (!isEnabled()) {
            log.warn("Gemini API Key is missing! Insights will use the rule-based fallback.");
        } else {
            log.info("Gemini summarization enabled with model: {}", this.model);
        }
    }

    @Override
    public SummaryResponse summarize(String prompt, Duration timeout) {
        if (!isEnabled()) {
            throw new SummarizationException(SummarizationException.Reason.UNAVAILABLE, "Gemini API key not configured");
        }

        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        GeminiResponse response;
        try {
            response = webClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequest(prompt))
                    .retrieve()
                    .bodyToMono(GeminiResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw SummarizationException.from(PROVIDER, e);
        }

        String text = extractContent(response);
        log.debug("Gemini answered with {} characters", text == null ? 0 : text.length());
        return responseParser.parse(text);
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    private GeminiRequest buildRequest(String prompt) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.3, 1024, "application/json"));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw new SummarizationException(SummarizationException.Reason.INVALID_RESPONSE,
                    "Gemini returned no candidates");
        }

        var candidate = response.candidates().get(0);

        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            throw new SummarizationException(SummarizationException.Reason.INVALID_RESPONSE,
                    "Gemini candidate has no content parts (finish reason " + candidate.finishReason() + ")");
        }

        return candidate.content().parts().get(0).text();
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens, String responseMimeType) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}

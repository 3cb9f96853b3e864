package dev.sitesage.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Implementation of SummarizationClient for any OpenAI-compatible chat completions API
 * (Groq, OpenRouter, OpenAI itself). Defaults to Groq.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "analyzer.insights.provider", havingValue = "openai")
public class OpenAiCompatibleSummarizationClient implements SummarizationClient {

    private static final String CHAT_PATH = "/chat/completions";
    private static final String PROVIDER = "Chat completions";

    private final WebClient webClient;
    private final LlmResponseParser responseParser;
    private final String apiKey;
    private final String model;

    public OpenAiCompatibleSummarizationClient(
            LlmResponseParser responseParser,
            @Value("${analyzer.insights.openai.api-key:}") String apiKey,
            @Value("${analyzer.insights.openai.model:llama-3.3-70b-versatile}") String model,
            @Value("${analyzer.insights.openai.base-url:https://api.groq.com/openai/v1}") String baseUrl) {
        this.responseParser = responseParser;
        this.apiKey = apiKey;
        this.model = model;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (!isEnabled()) {
            log.warn("Chat completions API Key is missing! Insights will use the rule-based fallback.");
        } else {
            log.info("Chat completions summarization enabled with model: {} at {}", model, baseUrl);
        }
    }

    @Override
    public SummaryResponse summarize(String prompt, Duration timeout) {
        if (!isEnabled()) {
            throw new SummarizationException(SummarizationException.Reason.UNAVAILABLE, "API key not configured");
        }

        ChatRequest request = new ChatRequest(model, List.of(new ChatRequest.Message("user", prompt)), 0.3, 1024);

        ChatResponse response;
        try {
            response = webClient.post()
                    .uri(CHAT_PATH)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw SummarizationException.from(PROVIDER, e);
        }

        return responseParser.parse(extractContent(response));
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    private String extractContent(ChatResponse response) {
        if (response != null && response.choices() != null && !response.choices().isEmpty()
                && response.choices().get(0).message() != null) {
            return response.choices().get(0).message().content();
        }
        throw new SummarizationException(SummarizationException.Reason.INVALID_RESPONSE,
                "Chat completions response had no choices");
    }

    // DTOs
    record ChatRequest(String model, List<Message> messages, double temperature,
            @JsonProperty("max_tokens") int maxTokens) {
        record Message(String role, String content) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}

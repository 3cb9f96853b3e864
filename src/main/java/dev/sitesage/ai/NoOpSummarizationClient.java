package dev.sitesage.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * No-op implementation of SummarizationClient.
 * Used when no summarization provider is configured; insights come from the rule-based fallback.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "analyzer.insights.provider", havingValue = "none", matchIfMissing = true)
public class NoOpSummarizationClient implements SummarizationClient {

    public NoOpSummarizationClient() {
        log.info("AI summarization disabled - using rule-based insights");
    }

    @Override
    public SummaryResponse summarize(String prompt, Duration timeout) {
        throw new SummarizationException(SummarizationException.Reason.UNAVAILABLE,
                "No summarization provider configured");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}

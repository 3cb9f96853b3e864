package dev.sitesage.ai;

import java.time.Duration;

/**
 * Interface for summarization services.
 * Can be implemented by AI-powered or no-op implementations.
 */
public interface SummarizationClient {

    /**
     * Summarize structured audit findings.
     *
     * @param prompt  bounded prompt describing the page, its scores and detected issues
     * @param timeout maximum time the call may take
     * @return the provider's summary and suggestions
     * @throws SummarizationException on timeout, quota exhaustion or an unusable response
     */
    SummaryResponse summarize(String prompt, Duration timeout);

    /**
     * Check if a summarization provider is configured.
     *
     * @return true if summarization is enabled and configured
     */
    boolean isEnabled();
}

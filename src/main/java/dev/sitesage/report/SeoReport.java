package dev.sitesage.report;

import dev.sitesage.model.AnalysisOutcome;
import dev.sitesage.model.Insights;
import dev.sitesage.model.PageSignals;
import dev.sitesage.model.ScoreBreakdown;

import java.time.Instant;

/**
 * Completed analysis of one page, as handed to persistence and returned by the API.
 */
public record SeoReport(
        String url,
        double seoScore,
        Metrics metrics,
        Insights aiInsights,
        Instant createdAt) {

    /**
     * Everything measured about the page: raw signals plus the score breakdown.
     */
    public record Metrics(PageSignals signals, ScoreBreakdown scores) {
    }

    public static SeoReport from(AnalysisOutcome.Success success) {
        return new SeoReport(
                success.url(),
                success.scores().seoScore(),
                new Metrics(success.signals(), success.scores()),
                success.insights(),
                success.analyzedAt());
    }
}

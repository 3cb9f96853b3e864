package dev.sitesage.ai;

import dev.sitesage.config.InsightConfig;
import dev.sitesage.model.PageSignals;
import dev.sitesage.model.Penalty;
import dev.sitesage.model.ScoreBreakdown;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the summarization prompt from structured findings.
 * Raw HTML never goes into the prompt and its length is capped by {@link InsightConfig#maxPromptChars()}.
 */
@Component
@RequiredArgsConstructor
public class InsightPromptBuilder {

    static final int MAX_HEADINGS = 10;
    private static final int MAX_FIELD_CHARS = 200;

    private static final String INSTRUCTIONS = """

            Respond ONLY with a JSON object in exactly this shape, without markdown:
            {"summary": "<2-3 sentence overview of the page's SEO health>",
             "suggestions": ["<specific, actionable improvement>", "..."]}
            Give at most 5 suggestions, most impactful first.
            """;

    private final InsightConfig insightConfig;

    public String build(String url, PageSignals signals, ScoreBreakdown scores) {
        StringBuilder body = new StringBuilder();
        body.append("You are an SEO consultant. Review the audit results for the page below.\n\n");
        body.append("URL: ").append(url).append('\n');
        body.append("Title: ").append(orNone(signals.title())).append('\n');
        body.append("Meta description: ").append(orNone(signals.metaDescription())).append('\n');
        body.append("H1 headings (").append(signals.h1Count()).append("): ")
                .append(headings(signals.h1Tags())).append('\n');
        body.append("H2 headings (").append(signals.h2Count()).append("): ")
                .append(headings(signals.h2Tags())).append('\n');
        body.append("Images: ").append(signals.imageCount())
                .append(" (").append(signals.missingAltTags()).append(" missing alt text)\n");
        body.append("Broken links: ").append(signals.brokenLinksCount()).append('\n');
        if (signals.hasTiming()) {
            body.append("Load time: ").append(signals.loadTimeSeconds()).append("s, HTML size: ")
                    .append(signals.htmlBytes() / 1024).append(" KB\n");
        }

        body.append("\nScores (0-100):\n");
        body.append("- SEO: ").append(scores.seoScore()).append('\n');
        appendScore(body, "Performance", scores.performanceScore());
        appendScore(body, "Accessibility", scores.accessibilityScore());
        appendScore(body, "Best practices", scores.bestPracticesScore());

        body.append("\nIssues identified:\n");
        if (scores.penalties().isEmpty()) {
            body.append("- none\n");
        }
        for (Penalty penalty : scores.penalties()) {
            body.append("- [").append(penalty.category()).append("] ").append(penalty.description()).append('\n');
        }

        int budget = insightConfig.maxPromptChars() - INSTRUCTIONS.length();
        String bounded = body.length() > budget ? body.substring(0, Math.max(0, budget)) : body.toString();
        return bounded + INSTRUCTIONS;
    }

    private static void appendScore(StringBuilder body, String label, Double score) {
        if (score != null) {
            body.append("- ").append(label).append(": ").append(score).append('\n');
        }
    }

    private static String headings(List<String> headings) {
        if (headings.isEmpty()) {
            return "none";
        }
        List<String> shown = headings.stream()
                .limit(MAX_HEADINGS)
                .map(InsightPromptBuilder::truncate)
                .toList();
        String joined = String.join(" | ", shown);
        return headings.size() > MAX_HEADINGS ? joined + " | ..." : joined;
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "(none)" : truncate(value);
    }

    private static String truncate(String value) {
        return value.length() > MAX_FIELD_CHARS ? value.substring(0, MAX_FIELD_CHARS) + "..." : value;
    }
}

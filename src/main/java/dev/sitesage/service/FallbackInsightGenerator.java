package dev.sitesage.service;

import dev.sitesage.config.ScoringConfig;
import dev.sitesage.model.Insights;
import dev.sitesage.model.PageSignals;
import dev.sitesage.model.Penalty;
import dev.sitesage.model.PenaltyType;
import dev.sitesage.model.ScoreBreakdown;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule-based insights built only from locally computed scores and penalties.
 * Never fails and never calls out.
 */
@Component
@RequiredArgsConstructor
public class FallbackInsightGenerator {

    private static final int KEY_ISSUES = 3;

    private final ScoringConfig scoringConfig;

    public Insights generate(PageSignals signals, ScoreBreakdown scores) {
        return new Insights(summary(scores), suggestions(signals, scores), Insights.InsightSource.RULES);
    }

    private String summary(ScoreBreakdown scores) {
        double score = scores.seoScore();
        String health;
        if (score >= 80) {
            health = "The page has strong SEO fundamentals (score " + score + "/100).";
        } else if (score >= 60) {
            health = "The page has moderate SEO health (score " + score + "/100) with room for improvement.";
        } else {
            health = "The page has significant SEO issues (score " + score + "/100) that need attention.";
        }

        if (scores.penalties().isEmpty()) {
            return health + " No issues were detected by the automated checks.";
        }

        String keyIssues = scores.penalties().stream()
                .limit(KEY_ISSUES)
                .map(Penalty::description)
                .collect(Collectors.joining("; "));
        return health + " Key issues: " + keyIssues + ".";
    }

    /**
     * One suggestion per penalty type, in penalty order.
     */
    private List<String> suggestions(PageSignals signals, ScoreBreakdown scores) {
        List<String> suggestions = new ArrayList<>();
        Set<PenaltyType> seen = EnumSet.noneOf(PenaltyType.class);

        for (Penalty penalty : scores.penalties()) {
            PenaltyType type = canonical(penalty.type());
            if (seen.add(type)) {
                suggestions.add(suggestionFor(type, signals));
            }
        }
        return suggestions;
    }

    // the best-practice duplicates share their SEO counterpart's advice
    private static PenaltyType canonical(PenaltyType type) {
        if (type == PenaltyType.BROKEN_LINKS_PRACTICE) {
            return PenaltyType.BROKEN_LINKS;
        }
        if (type == PenaltyType.NO_META_DESCRIPTION_PRACTICE) {
            return PenaltyType.MISSING_META_DESCRIPTION;
        }
        return type;
    }

    private String suggestionFor(PenaltyType type, PageSignals signals) {
        switch (type) {
            case MISSING_TITLE:
                return "Add a descriptive page title of up to " + scoringConfig.titleMaxLength()
                        + " characters that includes your primary keywords";
            case TITLE_TOO_LONG:
                return "Shorten the page title to " + scoringConfig.titleMaxLength()
                        + " characters or fewer so it is not truncated in search results";
            case MISSING_META_DESCRIPTION:
                return "Add a compelling meta description of up to " + scoringConfig.metaDescriptionMaxLength()
                        + " characters to improve click-through rates";
            case META_DESCRIPTION_TOO_LONG:
                return "Shorten the meta description to " + scoringConfig.metaDescriptionMaxLength()
                        + " characters or fewer";
            case MISSING_H1:
                return "Add a single H1 heading that clearly describes the page content";
            case DUPLICATE_H1:
                return "Keep one H1 heading per page and demote the other " + (signals.h1Count() - 1)
                        + " to H2 or lower";
            case MISSING_ALT_TEXT:
                return "Add descriptive alt text to the " + signals.missingAltTags() + " images that lack it";
            case BROKEN_LINKS:
                return "Fix or remove the " + signals.brokenLinksCount() + " broken links on the page";
            case SLOW_LOAD:
                return "Reduce page load time (currently " + signals.loadTimeSeconds()
                        + "s) by compressing assets, minifying CSS and JavaScript, and enabling caching";
            case LARGE_PAGE:
                return "Reduce the HTML document size (currently " + (signals.htmlBytes() / 1024)
                        + " KB) by moving inline scripts and styles into cached files";
            case MISSING_LABELS:
                return "Associate a label, aria-label or title with the "
                        + signals.accessibility().missingLabelsCount() + " unlabeled form controls";
            case MISSING_LANG:
                return "Declare the page language with a lang attribute on the <html> element";
            default:
                return "Review the page for " + type.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        }
    }
}

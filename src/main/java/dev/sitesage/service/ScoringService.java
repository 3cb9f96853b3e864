package dev.sitesage.service;

import dev.sitesage.config.ScoringConfig;
import dev.sitesage.model.AccessibilityInfo;
import dev.sitesage.model.PageSignals;
import dev.sitesage.model.Penalty;
import dev.sitesage.model.PenaltyType;
import dev.sitesage.model.ScoreBreakdown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for converting page signals into sub-scores.
 * Deterministic and free of I/O: the same signals always produce the same breakdown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {

    private static final double MAX_SCORE = 100.0;

    private final ScoringConfig scoringConfig;

    /**
     * Score a page.
     *
     * @param signals extracted page signals
     * @return breakdown with the SEO score always present and the other sub-scores null when the
     *         scoring profile disables them or the data they need is unavailable
     */
    public ScoreBreakdown score(PageSignals signals) {
        List<Penalty> penalties = new ArrayList<>();

        double seoScore = scoreSeo(signals, penalties);

        Double performanceScore = scoringConfig.performanceEnabled() && signals.hasTiming()
                ? scorePerformance(signals, penalties)
                : null;

        Double accessibilityScore = scoringConfig.accessibilityEnabled()
                ? scoreAccessibility(signals.accessibility(), penalties)
                : null;

        Double bestPracticesScore = scoringConfig.bestPracticesEnabled()
                ? scoreBestPractices(signals, penalties)
                : null;

        log.debug("Page '{}' scored seo={} performance={} accessibility={} bestPractices={}",
                signals.url(), seoScore, performanceScore, accessibilityScore, bestPracticesScore);

        return new ScoreBreakdown(seoScore, performanceScore, accessibilityScore, bestPracticesScore, penalties);
    }

    private double scoreSeo(PageSignals signals, List<Penalty> penalties) {
        int deductions = 0;

        // 1. Title
        String title = signals.title();
        if (isBlank(title)) {
            deductions += add(penalties, PenaltyType.MISSING_TITLE, scoringConfig.titlePenalty(),
                    "Missing page title");
        } else if (title.length() > scoringConfig.titleMaxLength()) {
            deductions += add(penalties, PenaltyType.TITLE_TOO_LONG, scoringConfig.titlePenalty(),
                    "Title is too long (" + title.length() + " > " + scoringConfig.titleMaxLength() + " characters)");
        }

        // 2. Meta description
        String description = signals.metaDescription();
        if (isBlank(description)) {
            deductions += add(penalties, PenaltyType.MISSING_META_DESCRIPTION, scoringConfig.metaDescriptionPenalty(),
                    "Missing meta description");
        } else if (description.length() > scoringConfig.metaDescriptionMaxLength()) {
            deductions += add(penalties, PenaltyType.META_DESCRIPTION_TOO_LONG, scoringConfig.metaDescriptionPenalty(),
                    "Meta description is too long (" + description.length() + " > "
                            + scoringConfig.metaDescriptionMaxLength() + " characters)");
        }

        // 3. H1 structure
        int h1Count = signals.h1Count();
        if (h1Count == 0) {
            deductions += add(penalties, PenaltyType.MISSING_H1, scoringConfig.missingH1Penalty(),
                    "No H1 tag found");
        } else if (h1Count > 1) {
            deductions += add(penalties, PenaltyType.DUPLICATE_H1, (h1Count - 1) * scoringConfig.duplicateH1Penalty(),
                    "Multiple H1 tags found (" + h1Count + ")");
        }

        // 4. Image alt text
        int missingAlts = signals.missingAltTags();
        if (missingAlts > 0) {
            int points = Math.min(scoringConfig.missingAltCap(), missingAlts * scoringConfig.missingAltPenalty());
            deductions += add(penalties, PenaltyType.MISSING_ALT_TEXT, points,
                    missingAlts + " of " + signals.imageCount() + " images missing alt text");
        }

        // 5. Broken links
        int brokenLinks = signals.brokenLinksCount();
        if (brokenLinks > 0) {
            int points = Math.min(scoringConfig.brokenLinkCap(), brokenLinks * scoringConfig.brokenLinkPenalty());
            deductions += add(penalties, PenaltyType.BROKEN_LINKS, points,
                    "Found " + brokenLinks + " broken links");
        }

        return clamp(MAX_SCORE - deductions);
    }

    /**
     * Minimum of a load-time factor and a page-size factor, each decaying linearly from 100 at the
     * "good" threshold to 0 at the "bad" threshold.
     */
    private double scorePerformance(PageSignals signals, List<Penalty> penalties) {
        double loadTime = signals.loadTimeSeconds();
        long bytes = signals.htmlBytes();

        double loadFactor = linearDecay(loadTime, scoringConfig.fastLoadSeconds(), scoringConfig.slowLoadSeconds());
        double sizeFactor = linearDecay(bytes, scoringConfig.smallPageBytes(), scoringConfig.largePageBytes());

        if (loadFactor < MAX_SCORE) {
            penalties.add(new Penalty(PenaltyType.SLOW_LOAD, round(MAX_SCORE - loadFactor),
                    "Slow page load time (" + loadTime + "s)"));
        }
        if (sizeFactor < MAX_SCORE) {
            penalties.add(new Penalty(PenaltyType.LARGE_PAGE, round(MAX_SCORE - sizeFactor),
                    "Large HTML document (" + (bytes / 1024) + " KB)"));
        }

        return clamp(Math.min(loadFactor, sizeFactor));
    }

    private double scoreAccessibility(AccessibilityInfo accessibility, List<Penalty> penalties) {
        int deductions = 0;

        int missingLabels = accessibility.missingLabelsCount();
        if (missingLabels > 0) {
            int points = Math.min(scoringConfig.missingLabelCap(), missingLabels * scoringConfig.missingLabelPenalty());
            deductions += add(penalties, PenaltyType.MISSING_LABELS, points,
                    "Found " + missingLabels + " form controls without an accessible label");
        }
        if (!accessibility.hasLang()) {
            deductions += add(penalties, PenaltyType.MISSING_LANG, scoringConfig.missingLangPenalty(),
                    "Missing 'lang' attribute on <html> tag");
        }

        return clamp(MAX_SCORE - deductions);
    }

    private double scoreBestPractices(PageSignals signals, List<Penalty> penalties) {
        int deductions = 0;

        int brokenLinks = signals.brokenLinksCount();
        if (brokenLinks > 0) {
            int points = Math.min(scoringConfig.brokenLinkPracticeCap(),
                    brokenLinks * scoringConfig.brokenLinkPracticePenalty());
            deductions += add(penalties, PenaltyType.BROKEN_LINKS_PRACTICE, points,
                    "Found " + brokenLinks + " broken links");
        }
        // also counted under SEO: a missing description is a best-practice problem as well
        if (isBlank(signals.metaDescription())) {
            deductions += add(penalties, PenaltyType.NO_META_DESCRIPTION_PRACTICE,
                    scoringConfig.noMetaDescriptionPracticePenalty(), "Missing meta description");
        }

        return clamp(MAX_SCORE - deductions);
    }

    private static int add(List<Penalty> penalties, PenaltyType type, int points, String description) {
        penalties.add(new Penalty(type, points, description));
        return points;
    }

    private static double linearDecay(double value, double good, double bad) {
        if (value <= good) {
            return MAX_SCORE;
        }
        if (value >= bad) {
            return 0.0;
        }
        return MAX_SCORE * (bad - value) / (bad - good);
    }

    private static double clamp(double score) {
        return round(Math.max(0.0, Math.min(MAX_SCORE, score)));
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package dev.sitesage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for scoring penalties, thresholds and the active scoring profile.
 * Loaded from application.yml under 'scoring' prefix.
 */
@ConfigurationProperties(prefix = "scoring")
public record ScoringConfig(
        Integer titleMaxLength,
        Integer metaDescriptionMaxLength,
        Integer titlePenalty,
        Integer metaDescriptionPenalty,
        Integer missingH1Penalty,
        Integer duplicateH1Penalty,
        Integer missingAltPenalty,
        Integer missingAltCap,
        Integer brokenLinkPenalty,
        Integer brokenLinkCap,
        Double fastLoadSeconds,
        Double slowLoadSeconds,
        Long smallPageBytes,
        Long largePageBytes,
        Integer missingLabelPenalty,
        Integer missingLabelCap,
        Integer missingLangPenalty,
        Integer brokenLinkPracticePenalty,
        Integer brokenLinkPracticeCap,
        Integer noMetaDescriptionPracticePenalty,
        Boolean performanceEnabled,
        Boolean accessibilityEnabled,
        Boolean bestPracticesEnabled) {

    public ScoringConfig {
        titleMaxLength = orDefault(titleMaxLength, 60);
        metaDescriptionMaxLength = orDefault(metaDescriptionMaxLength, 160);
        titlePenalty = orDefault(titlePenalty, 15);
        metaDescriptionPenalty = orDefault(metaDescriptionPenalty, 10);
        missingH1Penalty = orDefault(missingH1Penalty, 10);
        duplicateH1Penalty = orDefault(duplicateH1Penalty, 5);
        missingAltPenalty = orDefault(missingAltPenalty, 2);
        missingAltCap = orDefault(missingAltCap, 20);
        brokenLinkPenalty = orDefault(brokenLinkPenalty, 3);
        brokenLinkCap = orDefault(brokenLinkCap, 15);
        fastLoadSeconds = fastLoadSeconds != null ? fastLoadSeconds : 1.0;
        slowLoadSeconds = slowLoadSeconds != null ? slowLoadSeconds : 10.0;
        smallPageBytes = smallPageBytes != null ? smallPageBytes : 500L * 1024;
        largePageBytes = largePageBytes != null ? largePageBytes : 5L * 1024 * 1024;
        missingLabelPenalty = orDefault(missingLabelPenalty, 10);
        missingLabelCap = orDefault(missingLabelCap, 40);
        missingLangPenalty = orDefault(missingLangPenalty, 20);
        brokenLinkPracticePenalty = orDefault(brokenLinkPracticePenalty, 5);
        brokenLinkPracticeCap = orDefault(brokenLinkPracticeCap, 30);
        noMetaDescriptionPracticePenalty = orDefault(noMetaDescriptionPracticePenalty, 10);
        performanceEnabled = performanceEnabled != null ? performanceEnabled : Boolean.TRUE;
        accessibilityEnabled = accessibilityEnabled != null ? accessibilityEnabled : Boolean.TRUE;
        bestPracticesEnabled = bestPracticesEnabled != null ? bestPracticesEnabled : Boolean.TRUE;

        if (slowLoadSeconds <= fastLoadSeconds) {
            throw new IllegalArgumentException("scoring.slow-load-seconds must be greater than fast-load-seconds");
        }
        if (largePageBytes <= smallPageBytes) {
            throw new IllegalArgumentException("scoring.large-page-bytes must be greater than small-page-bytes");
        }
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(null, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Same thresholds with the optional sub-scores switched on or off.
     */
    public ScoringConfig withProfile(boolean performance, boolean accessibility, boolean bestPractices) {
        return new ScoringConfig(titleMaxLength, metaDescriptionMaxLength, titlePenalty, metaDescriptionPenalty,
                missingH1Penalty, duplicateH1Penalty, missingAltPenalty, missingAltCap, brokenLinkPenalty,
                brokenLinkCap, fastLoadSeconds, slowLoadSeconds, smallPageBytes, largePageBytes,
                missingLabelPenalty, missingLabelCap, missingLangPenalty, brokenLinkPracticePenalty,
                brokenLinkPracticeCap, noMetaDescriptionPracticePenalty, performance, accessibility, bestPractices);
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}

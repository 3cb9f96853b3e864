package dev.sitesage.model;

import java.util.List;

/**
 * Four independent sub-scores in [0,100]. Only the SEO score is mandatory; the others are null
 * when the active scoring profile or the available data does not allow computing them.
 */
public record ScoreBreakdown(
        double seoScore,
        Double performanceScore,
        Double accessibilityScore,
        Double bestPracticesScore,
        List<Penalty> penalties) {

    public ScoreBreakdown {
        requireInRange("seoScore", seoScore);
        if (performanceScore != null) {
            requireInRange("performanceScore", performanceScore);
        }
        if (accessibilityScore != null) {
            requireInRange("accessibilityScore", accessibilityScore);
        }
        if (bestPracticesScore != null) {
            requireInRange("bestPracticesScore", bestPracticesScore);
        }
        penalties = penalties == null ? List.of() : List.copyOf(penalties);
    }

    public List<Penalty> penaltiesFor(ScoreCategory category) {
        return penalties.stream()
                .filter(penalty -> penalty.category() == category)
                .toList();
    }

    private static void requireInRange(String name, double value) {
        if (!Double.isFinite(value) || value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " must be a finite number in [0,100], was " + value);
        }
    }
}

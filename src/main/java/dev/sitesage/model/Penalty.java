package dev.sitesage.model;

/**
 * One deduction applied by the scorer.
 *
 * @param type        what was penalized
 * @param points      points removed from the category's sub-score (positive)
 * @param description human-readable issue, e.g. "3 images missing alt text"
 */
public record Penalty(PenaltyType type, double points, String description) {

    public ScoreCategory category() {
        return type.category();
    }
}

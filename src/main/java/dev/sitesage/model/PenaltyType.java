package dev.sitesage.model;

/**
 * Every deduction the scorer can apply, grouped by the sub-score it lowers.
 */
public enum PenaltyType {
    MISSING_TITLE(ScoreCategory.SEO),
    TITLE_TOO_LONG(ScoreCategory.SEO),
    MISSING_META_DESCRIPTION(ScoreCategory.SEO),
    META_DESCRIPTION_TOO_LONG(ScoreCategory.SEO),
    MISSING_H1(ScoreCategory.SEO),
    DUPLICATE_H1(ScoreCategory.SEO),
    MISSING_ALT_TEXT(ScoreCategory.SEO),
    BROKEN_LINKS(ScoreCategory.SEO),

    SLOW_LOAD(ScoreCategory.PERFORMANCE),
    LARGE_PAGE(ScoreCategory.PERFORMANCE),

    MISSING_LABELS(ScoreCategory.ACCESSIBILITY),
    MISSING_LANG(ScoreCategory.ACCESSIBILITY),

    BROKEN_LINKS_PRACTICE(ScoreCategory.BEST_PRACTICES),
    NO_META_DESCRIPTION_PRACTICE(ScoreCategory.BEST_PRACTICES);

    private final ScoreCategory category;

    PenaltyType(ScoreCategory category) {
        this.category = category;
    }

    public ScoreCategory category() {
        return category;
    }
}

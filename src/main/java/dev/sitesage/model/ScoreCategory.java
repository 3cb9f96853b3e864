package dev.sitesage.model;

public enum ScoreCategory {
    SEO,
    PERFORMANCE,
    ACCESSIBILITY,
    BEST_PRACTICES
}

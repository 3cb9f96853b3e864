package dev.sitesage.model;

import java.util.List;

/**
 * Natural-language summary and ordered suggestions for one page.
 */
public record Insights(String summary, List<String> suggestions, InsightSource source) {

    public Insights {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("Insight summary must not be blank");
        }
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public enum InsightSource {
        /** Produced by the external summarization service. */
        AI,
        /** Produced locally from scorer penalties. */
        RULES
    }
}

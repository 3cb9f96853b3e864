package dev.sitesage.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a summarization provider answered, before validation and truncation.
 */
public record SummaryResponse(String summary, List<String> suggestions) {

    public SummaryResponse {
        // may hold nulls from loosely-typed model output; cleaned when mapped to insights
        suggestions = suggestions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(suggestions));
    }
}

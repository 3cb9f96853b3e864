package dev.sitesage.model;

import java.util.List;

/**
 * One outcome per input URL, in input order.
 */
public record BatchResult(List<AnalysisOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public List<AnalysisOutcome.Success> successes() {
        return outcomes.stream()
                .filter(AnalysisOutcome::isSuccess)
                .map(AnalysisOutcome.Success.class::cast)
                .toList();
    }

    public List<AnalysisOutcome.Failure> failures() {
        return outcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(AnalysisOutcome.Failure.class::cast)
                .toList();
    }
}

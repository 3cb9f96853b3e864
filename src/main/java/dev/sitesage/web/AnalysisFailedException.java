package dev.sitesage.web;

import dev.sitesage.model.AnalysisOutcome;
import lombok.Getter;

/**
 * Raised by the single-URL endpoint when the page's outcome is a failure.
 */
@Getter
public class AnalysisFailedException extends RuntimeException {

    private final transient AnalysisOutcome.Failure failure;

    public AnalysisFailedException(AnalysisOutcome.Failure failure) {
        super(failure.message());
        this.failure = failure;
    }
}

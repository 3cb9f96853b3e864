package dev.sitesage.model;

import java.time.Instant;

/**
 * Per-URL result of the pipeline: either a full {@link Success} record or a typed {@link Failure}.
 */
public interface AnalysisOutcome {

    String url();

    boolean isSuccess();

    /**
     * @param analyzedAt when the pipeline completed for this page
     */
    record Success(String url, PageSignals signals, ScoreBreakdown scores, Insights insights, Instant analyzedAt)
            implements AnalysisOutcome {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * @param httpStatus upstream status code, only set when kind is {@link FailureKind#HTTP_ERROR}
     */
    record Failure(String url, FailureKind kind, String message, Integer httpStatus)
            implements AnalysisOutcome {

        public static Failure of(String url, FailureKind kind, String message) {
            return new Failure(url, kind, message, null);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}

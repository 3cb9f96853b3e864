package dev.sitesage.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.sitesage.model.AnalysisOutcome;
import dev.sitesage.model.BatchResult;
import dev.sitesage.report.SeoReport;

import java.util.List;

/**
 * Batch response: successful reports, failures, and the per-URL results in input order.
 */
public record BatchAnalyzeResponse(
        List<SeoReport> reports,
        List<ErrorResponse> failures,
        List<Result> results) {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILURE = "failure";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(String url, String status, SeoReport report, ErrorResponse error) {
    }

    public static BatchAnalyzeResponse from(BatchResult batch) {
        List<Result> results = batch.outcomes().stream()
                .map(BatchAnalyzeResponse::toResult)
                .toList();
        List<SeoReport> reports = results.stream()
                .filter(result -> result.report() != null)
                .map(Result::report)
                .toList();
        List<ErrorResponse> failures = results.stream()
                .filter(result -> result.error() != null)
                .map(Result::error)
                .toList();
        return new BatchAnalyzeResponse(reports, failures, results);
    }

    private static Result toResult(AnalysisOutcome outcome) {
        if (outcome instanceof AnalysisOutcome.Success success) {
            return new Result(success.url(), STATUS_SUCCESS, SeoReport.from(success), null);
        }
        AnalysisOutcome.Failure failure = (AnalysisOutcome.Failure) outcome;
        return new Result(failure.url(), STATUS_FAILURE, null, toError(failure));
    }

    static ErrorResponse toError(AnalysisOutcome.Failure failure) {
        return new ErrorResponse(failure.kind().name(), failure.message(), failure.url());
    }
}

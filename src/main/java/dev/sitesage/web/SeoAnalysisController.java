package dev.sitesage.web;

import dev.sitesage.model.AnalysisOutcome;
import dev.sitesage.report.SeoReport;
import dev.sitesage.service.SiteAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST endpoints for page analysis.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/seo")
@RequiredArgsConstructor
public class SeoAnalysisController {

    private final SiteAnalysisService analysisService;

    @PostMapping("/analyze")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SeoReport> analyze(@RequestBody AnalyzeRequest request) {
        log.debug("Single analysis requested for {}", request.url());
        return analysisService.analyze(request.url())
                .map(outcome -> {
                    if (outcome instanceof AnalysisOutcome.Success success) {
                        return SeoReport.from(success);
                    }
                    throw new AnalysisFailedException((AnalysisOutcome.Failure) outcome);
                });
    }

    @PostMapping("/analyze/batch")
    public Mono<BatchAnalyzeResponse> analyzeBatch(@RequestBody BatchAnalyzeRequest request) {
        log.debug("Batch analysis requested for {} URLs", request.urls() == null ? 0 : request.urls().size());
        return analysisService.analyzeBatch(request.urls())
                .map(BatchAnalyzeResponse::from);
    }
}

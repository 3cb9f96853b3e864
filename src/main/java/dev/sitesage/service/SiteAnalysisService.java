package dev.sitesage.service;

import dev.sitesage.config.BatchConfig;
import dev.sitesage.config.FetchConfig;
import dev.sitesage.extract.LinkChecker;
import dev.sitesage.extract.PageExtractor;
import dev.sitesage.fetch.FetchException;
import dev.sitesage.fetch.PageFetcher;
import dev.sitesage.metrics.AnalysisMetrics;
import dev.sitesage.model.AnalysisOutcome;
import dev.sitesage.model.AnalysisRequest;
import dev.sitesage.model.BatchResult;
import dev.sitesage.model.FailureKind;
import dev.sitesage.model.ScoreBreakdown;
import dev.sitesage.model.ValidationException;
import dev.sitesage.report.ReportSink;
import dev.sitesage.report.SeoReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Main orchestration service for the page analysis pipeline.
 * Runs fetch, extraction, link probing, scoring and insight generation for each URL of a batch with
 * bounded concurrency, and returns exactly one outcome per input URL in input order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SiteAnalysisService {

    private final PageFetcher pageFetcher;
    private final PageExtractor pageExtractor;
    private final LinkChecker linkChecker;
    private final ScoringService scoringService;
    private final InsightService insightService;
    private final ReportSink reportSink;
    private final BatchConfig batchConfig;
    private final FetchConfig fetchConfig;
    private final AnalysisMetrics metrics;
    private final Clock clock;

    /**
     * Analyze a single page. Same code path as a batch of one.
     *
     * @return the page's outcome, or a {@link ValidationException} error if the URL is malformed
     */
    public Mono<AnalysisOutcome> analyze(String url) {
        return analyzeBatch(Collections.singletonList(url))
                .map(result -> result.outcomes().get(0));
    }

    public Mono<BatchResult> analyzeBatch(List<String> urls) {
        return analyzeBatch(urls, batchConfig.maxConcurrency());
    }

    /**
     * Analyze a batch of pages.
     *
     * @param urls           1 to {@code analyzer.batch.max-size} URLs
     * @param maxConcurrency pipelines allowed in flight at once, clamped to [1, max-size]
     * @return one outcome per URL in input order; errors only with {@link ValidationException},
     *         before any network call
     */
    public Mono<BatchResult> analyzeBatch(List<String> urls, int maxConcurrency) {
        return Mono.defer(() -> {
            List<AnalysisRequest> requests = validate(urls);
            int concurrency = Math.max(1, Math.min(maxConcurrency, batchConfig.maxSize()));
            int size = requests.size();
            AtomicReferenceArray<AnalysisOutcome> slots = new AtomicReferenceArray<>(size);

            log.info("Analyzing batch of {} URLs (concurrency {})", size, concurrency);
            long start = System.nanoTime();

            return Flux.range(0, size)
                    .flatMap(i -> analyzeOne(requests.get(i)).doOnNext(outcome -> slots.set(i, outcome)),
                            concurrency)
                    .then(Mono.fromSupplier(() -> assemble(slots)))
                    .doOnNext(result -> {
                        int failures = result.failures().size();
                        metrics.updateLastBatchStats(result.size(), failures);
                        log.info("Batch finished in {} ms: {} succeeded, {} failed",
                                (System.nanoTime() - start) / 1_000_000, result.size() - failures, failures);
                    });
        });
    }

    private List<AnalysisRequest> validate(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new ValidationException("At least one URL is required");
        }
        if (urls.size() > batchConfig.maxSize()) {
            throw new ValidationException("Batch size " + urls.size() + " exceeds the limit of "
                    + batchConfig.maxSize() + " URLs");
        }
        List<AnalysisRequest> requests = new ArrayList<>(urls.size());
        for (String url : urls) {
            requests.add(AnalysisRequest.of(url));
        }
        return requests;
    }

    /**
     * Run the pipeline for one URL. Never errors: every fault becomes this URL's failure outcome.
     */
    private Mono<AnalysisOutcome> analyzeOne(AnalysisRequest request) {
        String url = request.url();
        return Mono.defer(() -> {
            metrics.recordAnalysisStarted();
            long start = System.nanoTime();
            return Mono.defer(() -> pipeline(url))
                    .timeout(batchConfig.pipelineTimeout())
                    .switchIfEmpty(Mono.error(new IllegalStateException("Pipeline completed without a result")))
                    .onErrorResume(e -> Mono.just(toFailure(url, e)))
                    .doOnNext(outcome -> {
                        metrics.recordPipelineLatency((System.nanoTime() - start) / 1_000_000);
                        if (outcome instanceof AnalysisOutcome.Failure failure) {
                            metrics.recordFailure(failure.kind());
                        } else {
                            metrics.recordSuccess();
                        }
                    });
        });
    }

    private Mono<AnalysisOutcome> pipeline(String url) {
        return pageFetcher.fetch(url, fetchConfig.timeout())
                .publishOn(Schedulers.parallel())
                .map(pageExtractor::extract)
                .flatMap(extracted -> linkChecker.countBroken(url, extracted.externalLinks())
                        .map(extracted.signals()::withAdditionalBrokenLinks))
                .publishOn(Schedulers.parallel())
                .flatMap(signals -> {
                    ScoreBreakdown scores = scoringService.score(signals);
                    return insightService.summarize(url, signals, scores)
                            .map(insights -> new AnalysisOutcome.Success(url, signals, scores, insights,
                                    clock.instant()));
                })
                .doOnNext(this::publishReport)
                .cast(AnalysisOutcome.class);
    }

    // a sink fault must not turn a finished analysis into a failure
    private void publishReport(AnalysisOutcome.Success success) {
        try {
            reportSink.accept(SeoReport.from(success));
        } catch (RuntimeException e) {
            log.error("Report sink rejected the report for {}", success.url(), e);
        }
    }

    private AnalysisOutcome.Failure toFailure(String url, Throwable e) {
        if (e instanceof FetchException fetchException) {
            log.warn("Analysis of {} failed ({}): {}", url, fetchException.getKind(), e.getMessage());
            return new AnalysisOutcome.Failure(url, fetchException.getKind(), e.getMessage(),
                    fetchException.getHttpStatus());
        }
        if (e instanceof TimeoutException) {
            log.warn("Analysis of {} failed (TIMEOUT): no result within {}", url, batchConfig.pipelineTimeout());
            return AnalysisOutcome.Failure.of(url, FailureKind.TIMEOUT,
                    "Analysis did not complete within " + batchConfig.pipelineTimeout().toMillis() + "ms");
        }
        log.warn("Analysis of {} failed (INTERNAL)", url, e);
        return AnalysisOutcome.Failure.of(url, FailureKind.INTERNAL, "Unexpected error: " + e.getMessage());
    }

    private static BatchResult assemble(AtomicReferenceArray<AnalysisOutcome> slots) {
        List<AnalysisOutcome> outcomes = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            outcomes.add(slots.get(i));
        }
        return new BatchResult(outcomes);
    }
}

package dev.sitesage.metrics;

import dev.sitesage.model.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for page analysis operations.
 */
@Component
public class AnalysisMetrics {

    private static final String TAG_KIND = "kind";
    private final MeterRegistry registry;

    // Counters
    private final Counter analysesCounter;
    private final Counter successesCounter;
    private final Counter failuresCounter;
    private final Counter insightsFallbackCounter;
    private final Counter insightsAiCounter;
    private final Counter linkProbesCounter;

    // Timers
    private final Timer fetchTimer;
    private final Timer pipelineTimer;

    // Gauges
    private final AtomicInteger lastBatchSize = new AtomicInteger(0);
    private final AtomicInteger lastBatchFailures = new AtomicInteger(0);

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.analysesCounter = Counter.builder("sitesage_analyses_total")
                .description("Total URLs that entered the analysis pipeline")
                .register(registry);

        this.successesCounter = Counter.builder("sitesage_analyses_succeeded_total")
                .description("Total URLs analyzed successfully")
                .register(registry);

        this.failuresCounter = Counter.builder("sitesage_analyses_failed_total")
                .description("Total URLs whose analysis produced a failure outcome")
                .register(registry);

        this.insightsFallbackCounter = Counter.builder("sitesage_insights_fallback_total")
                .description("Insights produced by the rule-based fallback")
                .register(registry);

        this.insightsAiCounter = Counter.builder("sitesage_insights_ai_total")
                .description("Insights produced by the summarization service")
                .register(registry);

        this.linkProbesCounter = Counter.builder("sitesage_link_probes_total")
                .description("External links probed for breakage")
                .register(registry);

        this.fetchTimer = Timer.builder("sitesage_fetch_duration")
                .description("Time to download a page")
                .register(registry);

        this.pipelineTimer = Timer.builder("sitesage_pipeline_duration")
                .description("Time to run the full pipeline for one URL")
                .register(registry);

        Gauge.builder("sitesage_last_batch_size", lastBatchSize, AtomicInteger::get)
                .description("URLs in the last batch")
                .register(registry);

        Gauge.builder("sitesage_last_batch_failures", lastBatchFailures, AtomicInteger::get)
                .description("Failure outcomes in the last batch")
                .register(registry);
    }

    public void recordAnalysisStarted() {
        analysesCounter.increment();
    }

    public void recordSuccess() {
        successesCounter.increment();
    }

    /**
     * Record a failure outcome, both in total and per failure kind.
     */
    public void recordFailure(FailureKind kind) {
        failuresCounter.increment();
        Counter.builder("sitesage_analysis_failures_by_kind_total")
                .tag(TAG_KIND, kind.name())
                .register(registry)
                .increment();
    }

    public void recordFallbackInsights() {
        insightsFallbackCounter.increment();
    }

    public void recordAiInsights() {
        insightsAiCounter.increment();
    }

    public void recordLinkProbes(int count) {
        linkProbesCounter.increment(count);
    }

    public void recordFetchLatency(long latencyMs) {
        fetchTimer.record(Duration.ofMillis(latencyMs));
    }

    public void recordPipelineLatency(long latencyMs) {
        pipelineTimer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Update last batch statistics.
     */
    public void updateLastBatchStats(int size, int failures) {
        lastBatchSize.set(size);
        lastBatchFailures.set(failures);
    }
}

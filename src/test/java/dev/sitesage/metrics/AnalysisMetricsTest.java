package dev.sitesage.metrics;

import dev.sitesage.model.FailureKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisMetricsTest {

    private MeterRegistry meterRegistry;
    private AnalysisMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new AnalysisMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Analysis counters")
    class AnalysisCounterTests {

        @Test
        @DisplayName("Should count started, succeeded and failed analyses")
        void shouldCountOutcomes() {
            metrics.recordAnalysisStarted();
            metrics.recordAnalysisStarted();
            metrics.recordSuccess();
            metrics.recordFailure(FailureKind.TIMEOUT);

            assertThat(meterRegistry.counter("sitesage_analyses_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("sitesage_analyses_succeeded_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("sitesage_analyses_failed_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should tag failures by kind")
        void shouldTagFailuresByKind() {
            metrics.recordFailure(FailureKind.HTTP_ERROR);
            metrics.recordFailure(FailureKind.HTTP_ERROR);
            metrics.recordFailure(FailureKind.TOO_LARGE);

            assertThat(meterRegistry.counter("sitesage_analysis_failures_by_kind_total", "kind", "HTTP_ERROR").count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.counter("sitesage_analysis_failures_by_kind_total", "kind", "TOO_LARGE").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should count insight sources and link probes")
        void shouldCountInsightsAndProbes() {
            metrics.recordAiInsights();
            metrics.recordFallbackInsights();
            metrics.recordFallbackInsights();
            metrics.recordLinkProbes(7);

            assertThat(meterRegistry.counter("sitesage_insights_ai_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("sitesage_insights_fallback_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("sitesage_link_probes_total").count()).isEqualTo(7.0);
        }
    }

    @Nested
    @DisplayName("Timers and gauges")
    class TimerGaugeTests {

        @Test
        @DisplayName("Should record fetch and pipeline latency")
        void shouldRecordLatency() {
            metrics.recordFetchLatency(120);
            metrics.recordPipelineLatency(450);

            assertThat(meterRegistry.timer("sitesage_fetch_duration").count()).isEqualTo(1);
            assertThat(meterRegistry.timer("sitesage_pipeline_duration").totalTime(TimeUnit.MILLISECONDS))
                    .isEqualTo(450.0);
        }

        @Test
        @DisplayName("Should expose last batch statistics")
        void shouldUpdateLastBatchStats() {
            metrics.updateLastBatchStats(8, 3);

            assertThat(meterRegistry.get("sitesage_last_batch_size").gauge().value()).isEqualTo(8.0);
            assertThat(meterRegistry.get("sitesage_last_batch_failures").gauge().value()).isEqualTo(3.0);
        }
    }
}

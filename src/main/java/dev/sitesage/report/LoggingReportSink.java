package dev.sitesage.report;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sink used when no store is configured: logs a one-line summary of each report.
 */
@Slf4j
@Component
public class LoggingReportSink implements ReportSink {

    @Override
    public void accept(SeoReport report) {
        log.info("Report for {}: seo={} performance={} accessibility={} bestPractices={} issues={} insights={}",
                report.url(),
                report.seoScore(),
                report.metrics().scores().performanceScore(),
                report.metrics().scores().accessibilityScore(),
                report.metrics().scores().bestPracticesScore(),
                report.metrics().scores().penalties().size(),
                report.aiInsights().source());
    }
}

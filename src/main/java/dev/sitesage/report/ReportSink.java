package dev.sitesage.report;

/**
 * Persistence collaborator for completed reports.
 */
public interface ReportSink {

    /**
     * Store a completed report. Called once per successfully analyzed URL.
     */
    void accept(SeoReport report);
}

package dev.sitesage;

import dev.sitesage.ai.NoOpSummarizationClient;
import dev.sitesage.ai.SummarizationClient;
import dev.sitesage.report.LoggingReportSink;
import dev.sitesage.report.ReportSink;
import dev.sitesage.service.SiteAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

    @Autowired
    private SiteAnalysisService siteAnalysisService;

    @Autowired
    private SummarizationClient summarizationClient;

    @Autowired
    private ReportSink reportSink;

    @Test
    void contextLoads() {
        assertThat(siteAnalysisService).isNotNull();
        assertThat(summarizationClient).isInstanceOf(NoOpSummarizationClient.class);
        assertThat(reportSink).isInstanceOf(LoggingReportSink.class);
    }
}

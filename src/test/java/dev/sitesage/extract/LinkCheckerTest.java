package dev.sitesage.extract;

import dev.sitesage.config.FetchConfig;
import dev.sitesage.config.LinkCheckConfig;
import dev.sitesage.metrics.AnalysisMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LinkCheckerTest {

    private MockWebServer mockWebServer;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                if (path.startsWith("/ok")) {
                    return new MockResponse().setResponseCode(200);
                }
                if (path.startsWith("/gone")) {
                    return new MockResponse().setResponseCode(404);
                }
                if (path.startsWith("/no-head")) {
                    return "HEAD".equals(request.getMethod())
                            ? new MockResponse().setResponseCode(405)
                            : new MockResponse().setResponseCode(200).setBody("fine");
                }
                if (path.startsWith("/slow")) {
                    return new MockResponse().setResponseCode(200).setHeadersDelay(2, TimeUnit.SECONDS);
                }
                return new MockResponse().setResponseCode(500);
            }
        });
        mockWebServer.start();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private LinkChecker checker(LinkCheckConfig config) {
        return new LinkChecker(WebClient.builder(), config, FetchConfig.defaults(), new AnalysisMetrics(meterRegistry));
    }

    private String url(String path) {
        return mockWebServer.url(path).toString();
    }

    @Test
    @DisplayName("Should count error statuses as broken")
    void shouldCountBrokenLinks() {
        LinkChecker checker = checker(LinkCheckConfig.defaults());

        StepVerifier.create(checker.countBroken("https://example.com", List.of(url("/ok"), url("/gone"), url("/error"))))
                .expectNext(2)
                .verifyComplete();

        assertThat(meterRegistry.counter("sitesage_link_probes_total").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should retry with GET when HEAD is not allowed")
    void shouldFallBackToGet() {
        LinkChecker checker = checker(LinkCheckConfig.defaults());

        StepVerifier.create(checker.isBroken(url("/no-head")))
                .expectNext(false)
                .verifyComplete();

        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should treat unreachable and slow links as broken")
    void shouldTreatUnreachableAsBroken() throws IOException {
        LinkCheckConfig config = new LinkCheckConfig(true, 20, Duration.ofMillis(300), Duration.ofSeconds(5), 5);
        LinkChecker checker = checker(config);

        MockWebServer closed = new MockWebServer();
        closed.start();
        String unreachable = closed.url("/ok").toString();
        closed.shutdown();

        StepVerifier.create(checker.countBroken("https://example.com", List.of(unreachable, url("/slow"))))
                .expectNext(2)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should abandon probes still running when the total budget elapses")
    void shouldStopAtTotalBudget() {
        LinkCheckConfig config = new LinkCheckConfig(true, 20, Duration.ofSeconds(5), Duration.ofMillis(300), 5);
        LinkChecker checker = checker(config);
        List<String> links = List.of(url("/gone"), url("/slow/1"), url("/slow/2"), url("/slow/3"));

        long start = System.nanoTime();
        StepVerifier.create(checker.countBroken("https://example.com", links))
                .expectNext(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(elapsed).isLessThan(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("Should probe at most the configured sample of distinct links")
    void shouldLimitSample() {
        LinkCheckConfig config = new LinkCheckConfig(true, 2, null, null, 1);
        LinkChecker checker = checker(config);

        StepVerifier.create(checker.countBroken("https://example.com",
                        List.of(url("/ok/1"), url("/ok/1"), url("/ok/2"), url("/gone"))))
                .expectNext(0)
                .verifyComplete();

        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not probe when disabled or when there are no links")
    void shouldSkipWhenDisabled() {
        LinkChecker disabled = checker(LinkCheckConfig.disabled());

        StepVerifier.create(disabled.countBroken("https://example.com", List.of(url("/gone"))))
                .expectNext(0)
                .verifyComplete();
        StepVerifier.create(checker(LinkCheckConfig.defaults()).countBroken("https://example.com", List.of()))
                .expectNext(0)
                .verifyComplete();

        assertThat(mockWebServer.getRequestCount()).isZero();
    }
}

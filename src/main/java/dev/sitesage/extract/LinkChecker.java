package dev.sitesage.extract;

import dev.sitesage.config.FetchConfig;
import dev.sitesage.config.LinkCheckConfig;
import dev.sitesage.metrics.AnalysisMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Probes a bounded sample of external links and counts the broken ones.
 * A link is broken when it answers with a status of 400 or above or cannot be reached at all.
 */
@Slf4j
@Component
public class LinkChecker {

    private static final int NO_STATUS = -1;

    private final WebClient webClient;
    private final LinkCheckConfig linkCheckConfig;
    private final AnalysisMetrics metrics;

    public LinkChecker(WebClient.Builder webClientBuilder, LinkCheckConfig linkCheckConfig,
                       FetchConfig fetchConfig, AnalysisMetrics metrics) {
        HttpClient httpClient = HttpClient.create().followRedirect(true);

        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(HttpHeaders.USER_AGENT, fetchConfig.userAgent())
                .build();
        this.linkCheckConfig = linkCheckConfig;
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return linkCheckConfig.enabled() && linkCheckConfig.sampleSize() > 0;
    }

    /**
     * Count broken links among the first {@code sample-size} candidates. Probes still running when
     * the total link-check budget elapses are abandoned and not counted.
     *
     * @param pageUrl page the links were found on, for logging
     * @param links   candidate external links
     * @return Mono with the number of broken links; never an error
     */
    public Mono<Integer> countBroken(String pageUrl, List<String> links) {
        if (!isEnabled() || links == null || links.isEmpty()) {
            return Mono.just(0);
        }

        List<String> sample = links.stream()
                .distinct()
                .limit(linkCheckConfig.sampleSize())
                .toList();
        metrics.recordLinkProbes(sample.size());
        log.debug("Probing {} external links for {}", sample.size(), pageUrl);

        return Flux.fromIterable(sample)
                .flatMap(this::isBroken, linkCheckConfig.concurrency())
                .take(linkCheckConfig.totalTimeout())
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue)
                .doOnNext(broken -> {
                    if (broken > 0) {
                        log.debug("{} - {} of {} probed links are broken", pageUrl, broken, sample.size());
                    }
                });
    }

    Mono<Boolean> isBroken(String link) {
        // some servers reject HEAD, so fall back to GET before calling the link broken
        return probe(HttpMethod.HEAD, link)
                .onErrorReturn(NO_STATUS)
                .flatMap(status -> status == NO_STATUS || status == 405 || status == 501
                        ? probe(HttpMethod.GET, link)
                        : Mono.just(status))
                .map(status -> status >= 400)
                .onErrorResume(e -> {
                    log.debug("Link {} unreachable: {}", link, e.getMessage());
                    return Mono.just(true);
                });
    }

    private Mono<Integer> probe(HttpMethod method, String link) {
        return Mono.defer(() -> webClient.method(method)
                        .uri(URI.create(link))
                        .exchangeToMono(response -> response.releaseBody()
                                .thenReturn(response.statusCode().value())))
                .timeout(linkCheckConfig.probeTimeout());
    }
}

package dev.sitesage.fetch;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Network fetch capability: one GET per call, bounded by a timeout and a maximum body size.
 */
public interface PageFetcher {

    /**
     * Fetch the markup of a page.
     *
     * @param url     absolute http(s) URL
     * @param timeout time allowed from request start to full body receipt
     * @return Mono with the page, or an error signal carrying a {@link FetchException}
     */
    Mono<FetchedPage> fetch(String url, Duration timeout);
}

package dev.sitesage.fetch;

import dev.sitesage.config.FetchConfig;
import dev.sitesage.metrics.AnalysisMetrics;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * {@link PageFetcher} backed by a Reactor Netty {@link WebClient}.
 */
@Slf4j
@Component
public class WebClientPageFetcher implements PageFetcher {

    private final WebClient webClient;
    private final FetchConfig fetchConfig;
    private final AnalysisMetrics metrics;

    public WebClientPageFetcher(WebClient.Builder webClientBuilder, FetchConfig fetchConfig, AnalysisMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(fetchConfig.followRedirects())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE,
                        fetchConfig.timeout().toMillis()))
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(fetchConfig.maxBytes()))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(HttpHeaders.USER_AGENT, fetchConfig.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .build();
        this.fetchConfig = fetchConfig;
        this.metrics = metrics;
    }

    @Override
    public Mono<FetchedPage> fetch(String url, Duration timeout) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return webClient.get()
                    .uri(URI.create(url))
                    .exchangeToMono(response -> readBody(url, response))
                    .timeout(timeout)
                    .map(body -> {
                        long elapsedNanos = System.nanoTime() - start;
                        metrics.recordFetchLatency(elapsedNanos / 1_000_000);
                        double loadTime = Math.round(elapsedNanos / 10_000_000.0) / 100.0;
                        String html = decode(url, body);
                        log.debug("Fetched {} ({} bytes, {}s)", url, body.bytes().length, loadTime);
                        return new FetchedPage(url, body.status(), html, loadTime, body.bytes().length);
                    })
                    .onErrorMap(e -> !(e instanceof FetchException), e -> translate(url, e));
        });
    }

    private Mono<RawBody> readBody(String url, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        // a 3xx here was not followed (disabled or no Location), so there is no page to analyze
        if (status.isError() || status.is3xxRedirection()) {
            return response.releaseBody().then(Mono.error(FetchException.httpError(url, status.value())));
        }

        long declaredLength = response.headers().contentLength().orElse(-1L);
        if (declaredLength > fetchConfig.maxBytes()) {
            return response.releaseBody().then(Mono.error(FetchException.tooLarge(url, fetchConfig.maxBytes(), null)));
        }

        Charset charset = headerCharset(url, response);

        // raw buffers, so a malformed Content-Type never reaches codec selection
        return DataBufferUtils.join(response.body(BodyExtractors.toDataBuffers()), fetchConfig.maxBytes())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return new RawBody(status.value(), bytes, charset);
                })
                .defaultIfEmpty(new RawBody(status.value(), new byte[0], charset));
    }

    private static Charset headerCharset(String url, ClientResponse response) {
        try {
            return response.headers().contentType()
                    .map(MediaType::getCharset)
                    .orElse(null);
        } catch (InvalidMediaTypeException e) {
            log.debug("Ignoring unusable Content-Type of {}: {}", url, e.getMessage());
            return null;
        }
    }

    /**
     * Decode the body with the header charset, or else the charset jsoup detects from the BOM or
     * a {@code <meta charset>} declaration, falling back to UTF-8.
     */
    private static String decode(String url, RawBody body) {
        String headerCharset = body.charset() != null ? body.charset().name() : null;
        Charset charset;
        try {
            charset = Jsoup.parse(new ByteArrayInputStream(body.bytes()), headerCharset, url).charset();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        String html = new String(body.bytes(), charset);
        return !html.isEmpty() && html.charAt(0) == '\uFEFF' ? html.substring(1) : html;
    }

    private Throwable translate(String url, Throwable error) {
        if (hasCause(error, DataBufferLimitException.class)) {
            return FetchException.tooLarge(url, fetchConfig.maxBytes(), error);
        }
        if (hasCause(error, TimeoutException.class)
                || hasCause(error, io.netty.handler.timeout.TimeoutException.class)
                || hasCause(error, io.netty.channel.ConnectTimeoutException.class)) {
            return FetchException.timeout(url, error);
        }
        if (error instanceof WebClientRequestException || hasCause(error, IOException.class)) {
            return FetchException.connectionError(url, error.getCause() != null ? error.getCause() : error);
        }
        // anything else is an internal fault, reported as such by the pipeline
        return error;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }

    private record RawBody(int status, byte[] bytes, Charset charset) {
    }
}

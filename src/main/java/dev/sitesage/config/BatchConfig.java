package dev.sitesage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Batch admission settings.
 * Loaded from application.yml under 'analyzer.batch' prefix.
 */
@ConfigurationProperties(prefix = "analyzer.batch")
public record BatchConfig(
        Integer maxSize,
        Integer maxConcurrency,
        Duration pipelineTimeout) {

    public BatchConfig {
        maxSize = maxSize != null ? Math.max(1, maxSize) : 10;
        // the cap defaults to the batch size limit
        maxConcurrency = maxConcurrency != null ? Math.max(1, maxConcurrency) : maxSize;
        pipelineTimeout = pipelineTimeout != null ? pipelineTimeout : Duration.ofSeconds(60);
    }

    public static BatchConfig defaults() {
        return new BatchConfig(null, null, null);
    }
}

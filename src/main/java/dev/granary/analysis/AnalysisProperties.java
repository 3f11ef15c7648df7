package dev.granary.analysis;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Document analysis settings bound from {@code granary.analysis.*}.
 *
 * @param baseUrl analysis sidecar base URL
 * @param connectTimeoutMs connect timeout for sidecar calls
 * @param readTimeoutMs read timeout for sidecar calls
 * @param workerThreads reanalysis worker threads
 * @param queueCapacity pending reanalysis requests accepted before rejecting
 * @param retry sidecar retry budget
 */
@ConfigurationProperties(prefix = "granary.analysis")
public record AnalysisProperties(
    String baseUrl,
    int connectTimeoutMs,
    int readTimeoutMs,
    int workerThreads,
    int queueCapacity,
    Retry retry) {

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}

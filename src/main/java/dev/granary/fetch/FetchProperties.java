package dev.granary.fetch;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fetch layer settings bound from {@code granary.fetch.*}.
 *
 * @param userAgent desktop browser user agent sent by both fetch paths
 * @param connectTimeoutMs plain HTTP connect timeout
 * @param readTimeoutMs plain HTTP read timeout
 * @param navigationTimeoutMs browser navigation timeout when the caller sets none
 * @param selectorTimeoutMs how long the browser waits for an optional selector
 * @param settleDelayMs pause after DOMContentLoaded so late scripts can render
 * @param browserConcurrency maximum callers holding a browser lease at once
 * @param headless whether Chromium runs headless
 */
@ConfigurationProperties(prefix = "granary.fetch")
public record FetchProperties(
    String userAgent,
    int connectTimeoutMs,
    int readTimeoutMs,
    int navigationTimeoutMs,
    int selectorTimeoutMs,
    int settleDelayMs,
    int browserConcurrency,
    boolean headless) {}

package dev.granary.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry budget for catalog and analysis persistence calls, bound from {@code
 * granary.persistence.retry.*}.
 *
 * @param maxRetries retries after the first attempt (default 3)
 * @param baseDelayMs delay before the first retry (default 1000)
 * @param backoffFactor multiplier applied to the delay after each retry (default 2)
 */
@ConfigurationProperties(prefix = "granary.persistence.retry")
public record RetryProperties(int maxRetries, long baseDelayMs, double backoffFactor) {}

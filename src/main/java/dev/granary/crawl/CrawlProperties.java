package dev.granary.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Crawl scheduling settings bound from {@code granary.crawl.*}.
 *
 * @param detailDelayMs pause between consecutive detail fetches of one job
 * @param cron schedule of the daily batch (Asia/Seoul)
 * @param pendingPollMs interval of the pending-job poll
 * @param workerThreads concurrent crawl jobs
 * @param queueCapacity jobs waiting for a worker
 */
@ConfigurationProperties(prefix = "granary.crawl")
public record CrawlProperties(
    long detailDelayMs, String cron, long pendingPollMs, int workerThreads, int queueCapacity) {

  public CrawlProperties {
    if (detailDelayMs < 0) {
      throw new IllegalArgumentException(
          "granary.crawl.detail-delay-ms must not be negative, got: " + detailDelayMs);
    }
    if (cron == null || cron.isBlank()) {
      cron = "0 0 6 * * *";
    }
    if (pendingPollMs <= 0) {
      pendingPollMs = 60_000;
    }
    if (workerThreads <= 0) {
      workerThreads = 2;
    }
    if (queueCapacity <= 0) {
      queueCapacity = 100;
    }
  }
}

package dev.granary.api;

import dev.granary.crawl.CrawlJob;
import dev.granary.crawl.CrawlJobStats;
import dev.granary.crawl.CrawlJobStatus;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** REST view of a crawl job. */
public record CrawlJobView(
    UUID id,
    UUID sourceId,
    CrawlJobStatus status,
    CrawlJobStats stats,
    @Nullable String errorMessage,
    @Nullable Instant createdAt,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt) {

  static CrawlJobView from(CrawlJob job) {
    return new CrawlJobView(
        job.getId(),
        job.getSourceId(),
        job.getStatus(),
        job.stats(),
        job.getErrorMessage(),
        job.getCreatedAt(),
        job.getStartedAt(),
        job.getCompletedAt());
  }
}

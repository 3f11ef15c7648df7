package dev.granary.crawl;

/**
 * Lifecycle states for a {@link CrawlJob}.
 *
 * <p>Flow: {@code PENDING → RUNNING → COMPLETED} or {@code FAILED}. Terminal states are final.
 */
public enum CrawlJobStatus {
  /** Created by the dispatcher or an external trigger, awaiting a worker. */
  PENDING,
  /** Listing fetched or being fetched; items are being processed. */
  RUNNING,
  /** All items visited; counters may be partial when some items failed. */
  COMPLETED,
  /** The listing could not be fetched or extracted. */
  FAILED;

  boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}

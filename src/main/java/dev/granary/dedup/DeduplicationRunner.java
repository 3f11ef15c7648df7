package dev.granary.dedup;

import dev.granary.persistence.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Drives {@link DeduplicationService#groupBatch} until the backlog is empty. */
@Component
public class DeduplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DeduplicationRunner.class);

  private final DeduplicationService deduplicationService;
  private final RetryPolicy retryPolicy;
  private final DedupProperties properties;

  public DeduplicationRunner(
      DeduplicationService deduplicationService,
      RetryPolicy retryPolicy,
      DedupProperties properties) {
    this.deduplicationService = deduplicationService;
    this.retryPolicy = retryPolicy;
    this.properties = properties;
  }

  /**
   * Runs batches until one processes nothing. Each batch is retried as a whole when it fails
   * transiently. Stops after {@code maxIterations} batches.
   *
   * @return totals over all batches
   */
  public GroupingResult runUntilDrained() {
    GroupingResult total = GroupingResult.EMPTY;
    for (int i = 0; i < properties.maxIterations(); i++) {
      GroupingResult batch =
          retryPolicy.execute(
              "dedup batch", () -> deduplicationService.groupBatch(properties.batchSize()));
      if (batch.processed() == 0) {
        log.info(
            "Dedup drained after {} batches: {} processed, {} groups created, {} grouped",
            i,
            total.processed(),
            total.groupsCreated(),
            total.projectsGrouped());
        return total;
      }
      total = total.plus(batch);
    }
    log.warn(
        "Dedup stopped after {} batches with backlog remaining ({} processed)",
        properties.maxIterations(),
        total.processed());
    return total;
  }
}

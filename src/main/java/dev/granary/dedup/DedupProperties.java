package dev.granary.dedup;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deduplication settings bound from {@code granary.dedup.*}.
 *
 * @param batchSize announcements examined per transaction
 * @param amountTolerance relative spread of {@code amountMax} above which a group needs review
 * @param maxIterations safety bound on batches per drain
 */
@ConfigurationProperties(prefix = "granary.dedup")
public record DedupProperties(int batchSize, double amountTolerance, int maxIterations) {

  public DedupProperties {
    if (batchSize <= 0) {
      batchSize = 50;
    }
    if (amountTolerance <= 0) {
      amountTolerance = 0.2;
    }
    if (maxIterations <= 0) {
      maxIterations = 1000;
    }
  }
}

package dev.granary.ingestion;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Search index maintenance settings bound from {@code granary.indexing.*}.
 *
 * @param chunkSizeWords words per chunk
 * @param overlapWords words shared by consecutive chunks
 * @param refreshBatchSize stale announcements re-indexed per refresh run
 * @param refreshIntervalMs delay between refresh runs
 */
@ConfigurationProperties(prefix = "granary.indexing")
public record IndexingProperties(
    int chunkSizeWords, int overlapWords, int refreshBatchSize, long refreshIntervalMs) {

  public IndexingProperties {
    if (chunkSizeWords <= 0) {
      chunkSizeWords = 512;
    }
    if (overlapWords < 0 || overlapWords >= chunkSizeWords) {
      throw new IllegalArgumentException(
          "granary.indexing.overlap-words must be in [0, chunk-size-words), got: " + overlapWords);
    }
    if (refreshBatchSize <= 0) {
      refreshBatchSize = 20;
    }
  }
}

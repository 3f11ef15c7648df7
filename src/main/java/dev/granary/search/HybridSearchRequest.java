package dev.granary.search;

import org.jspecify.annotations.Nullable;

/**
 * Hybrid search query.
 *
 * @param queryText free-text query (must not be blank)
 * @param sourceType optional {@code announcement} / {@code attachment} restriction
 * @param matchThreshold minimum semantic similarity a chunk needs to be returned, in [0, 1]
 * @param matchCount maximum number of results, in [1, {@value #MAX_MATCH_COUNT}]
 * @param semanticWeight weight of the semantic score in the combined score, in [0, 1]
 */
public record HybridSearchRequest(
    String queryText,
    @Nullable String sourceType,
    double matchThreshold,
    int matchCount,
    double semanticWeight) {

  static final double DEFAULT_MATCH_THRESHOLD = 0.7;
  static final int DEFAULT_MATCH_COUNT = 10;
  static final double DEFAULT_SEMANTIC_WEIGHT = 0.7;
  public static final int MAX_MATCH_COUNT = 100;

  /** Compact constructor validating input. */
  public HybridSearchRequest {
    if (queryText == null || queryText.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (matchThreshold < 0.0 || matchThreshold > 1.0) {
      throw new IllegalArgumentException(
          "matchThreshold must be in [0, 1], got: " + matchThreshold);
    }
    if (matchCount < 1 || matchCount > MAX_MATCH_COUNT) {
      throw new IllegalArgumentException(
          "matchCount must be in [1, " + MAX_MATCH_COUNT + "], got: " + matchCount);
    }
    if (semanticWeight < 0.0 || semanticWeight > 1.0) {
      throw new IllegalArgumentException(
          "semanticWeight must be in [0, 1], got: " + semanticWeight);
    }
  }

  /** Convenience constructor with default threshold, count and weight and no type filter. */
  public HybridSearchRequest(String queryText) {
    this(
        queryText, null, DEFAULT_MATCH_THRESHOLD, DEFAULT_MATCH_COUNT, DEFAULT_SEMANTIC_WEIGHT);
  }

  /** Convenience constructor with a type filter and default scoring parameters. */
  public HybridSearchRequest(String queryText, @Nullable String sourceType) {
    this(
        queryText,
        sourceType,
        DEFAULT_MATCH_THRESHOLD,
        DEFAULT_MATCH_COUNT,
        DEFAULT_SEMANTIC_WEIGHT);
  }
}

package dev.granary.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Pure static utility combining semantic similarity with keyword overlap.
 *
 * <p>{@code combined = w * semantic + (1 - w) * keyword}, where {@code keyword} is the share of
 * query keywords present in the chunk's keyword set.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class HybridScoring {

  private HybridScoring() {}

  /**
   * Share of query keywords that also appear among the chunk keywords.
   *
   * @return value in [0, 1]; 0 when the query has no keywords
   */
  static double keywordScore(Set<String> queryKeywords, Set<String> chunkKeywords) {
    if (queryKeywords.isEmpty()) {
      return 0.0;
    }
    long hits = queryKeywords.stream().filter(chunkKeywords::contains).count();
    return (double) hits / queryKeywords.size();
  }

  static double combine(double semantic, double keyword, double semanticWeight) {
    return semanticWeight * semantic + (1.0 - semanticWeight) * keyword;
  }

  /**
   * Drops candidates below the semantic threshold, scores the rest and returns the best ones.
   *
   * @param candidates chunks with their semantic similarity and keyword set
   * @param queryKeywords keywords of the query
   * @param semanticWeight weight of the semantic score
   * @param matchThreshold minimum semantic similarity
   * @param matchCount maximum number of results
   * @return results sorted by combined score descending
   */
  static List<HybridSearchResult> rank(
      List<Candidate> candidates,
      Set<String> queryKeywords,
      double semanticWeight,
      double matchThreshold,
      int matchCount) {
    List<HybridSearchResult> scored = new ArrayList<>();
    for (Candidate c : candidates) {
      if (c.similarity() < matchThreshold) {
        continue;
      }
      double keyword = keywordScore(queryKeywords, c.keywords());
      scored.add(
          new HybridSearchResult(
              c.id(),
              c.sourceType(),
              c.sourceId(),
              c.content(),
              c.chunkIndex(),
              c.similarity(),
              keyword,
              combine(c.similarity(), keyword, semanticWeight)));
    }
    scored.sort(Comparator.comparingDouble(HybridSearchResult::combinedScore).reversed());
    return scored.size() > matchCount ? List.copyOf(scored.subList(0, matchCount)) : scored;
  }

  /** A chunk fetched from the vector store, before keyword scoring. */
  record Candidate(
      String id,
      String sourceType,
      UUID sourceId,
      String content,
      int chunkIndex,
      double similarity,
      Set<String> keywords) {}
}

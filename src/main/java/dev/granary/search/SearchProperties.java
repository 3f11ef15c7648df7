package dev.granary.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for hybrid search.
 *
 * <p>Properties are bound from {@code granary.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code match-threshold} - default minimum semantic similarity (default 0.7)
 *   <li>{@code match-count} - default number of results (default 10)
 *   <li>{@code semantic-weight} - default weight of the semantic score (0.0 = keywords only, 1.0 =
 *       semantic only; default 0.7)
 *   <li>{@code candidate-multiplier} - how many times {@code match-count} candidates are fetched
 *       from the vector store in the first window (default 5, bounded [1, 20])
 *   <li>{@code max-candidates} - ceiling of the candidate window, which grows while the store keeps
 *       filling it (default 1000, at least {@code match-count})
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "granary.search")
public class SearchProperties {

  private double matchThreshold = HybridSearchRequest.DEFAULT_MATCH_THRESHOLD;
  private int matchCount = HybridSearchRequest.DEFAULT_MATCH_COUNT;
  private double semanticWeight = HybridSearchRequest.DEFAULT_SEMANTIC_WEIGHT;
  private int candidateMultiplier = 5;
  private int maxCandidates = 1000;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (matchThreshold < 0.0 || matchThreshold > 1.0) {
      throw new IllegalStateException(
          "granary.search.match-threshold must be in [0.0, 1.0], got: " + matchThreshold);
    }
    if (matchCount < 1 || matchCount > HybridSearchRequest.MAX_MATCH_COUNT) {
      throw new IllegalStateException(
          "granary.search.match-count must be in [1, "
              + HybridSearchRequest.MAX_MATCH_COUNT
              + "], got: "
              + matchCount);
    }
    if (semanticWeight < 0.0 || semanticWeight > 1.0) {
      throw new IllegalStateException(
          "granary.search.semantic-weight must be in [0.0, 1.0], got: " + semanticWeight);
    }
    if (candidateMultiplier < 1 || candidateMultiplier > 20) {
      throw new IllegalStateException(
          "granary.search.candidate-multiplier must be in [1, 20], got: " + candidateMultiplier);
    }
    if (maxCandidates < HybridSearchRequest.MAX_MATCH_COUNT) {
      throw new IllegalStateException(
          "granary.search.max-candidates must be at least "
              + HybridSearchRequest.MAX_MATCH_COUNT
              + ", got: "
              + maxCandidates);
    }
  }

  public double getMatchThreshold() {
    return matchThreshold;
  }

  public void setMatchThreshold(double matchThreshold) {
    this.matchThreshold = matchThreshold;
  }

  public int getMatchCount() {
    return matchCount;
  }

  public void setMatchCount(int matchCount) {
    this.matchCount = matchCount;
  }

  public double getSemanticWeight() {
    return semanticWeight;
  }

  public void setSemanticWeight(double semanticWeight) {
    this.semanticWeight = semanticWeight;
  }

  public int getCandidateMultiplier() {
    return candidateMultiplier;
  }

  public void setCandidateMultiplier(int candidateMultiplier) {
    this.candidateMultiplier = candidateMultiplier;
  }

  public int getMaxCandidates() {
    return maxCandidates;
  }

  public void setMaxCandidates(int maxCandidates) {
    this.maxCandidates = maxCandidates;
  }
}

package dev.granary.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.granary.ingestion.IndexSourceType;
import dev.granary.ingestion.chunking.KeywordExtractor;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.RelevanceScore;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval over the chunk index: fetch every chunk above the similarity threshold, then
 * rescore each candidate with keyword overlap against the query.
 *
 * <p>Pipeline: embed query -> optional {@code source_type} filter -> fetch the nearest chunks
 * above the threshold, starting with a window of {@code candidateMultiplier * matchCount} and
 * doubling it while the store fills the window (up to {@code maxCandidates}) -> keyword scoring
 * from the {@code keywords} metadata -> sort by combined score -> top {@code matchCount}.
 */
@Service
public class HybridSearchService {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries, never to indexed chunks.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final SearchProperties properties;

  public HybridSearchService(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      SearchProperties properties) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.properties = properties;
  }

  /**
   * Runs a hybrid search.
   *
   * @param request query, optional type filter and scoring parameters
   * @return at most {@code matchCount} results ordered by combined score descending
   * @throws IllegalArgumentException if the source type filter is unknown
   */
  public List<HybridSearchResult> hybridSearch(HybridSearchRequest request) {
    Embedding queryEmbedding =
        embeddingModel.embed(BGE_QUERY_PREFIX + request.queryText()).content();

    String sourceType = normalizeSourceType(request.sourceType());
    List<EmbeddingMatch<TextSegment>> matches =
        aboveThreshold(queryEmbedding, sourceType, request.matchThreshold(), request.matchCount());
    List<HybridScoring.Candidate> candidates = new ArrayList<>(matches.size());
    for (EmbeddingMatch<TextSegment> match : matches) {
      HybridScoring.Candidate candidate = toCandidate(match);
      if (candidate != null) {
        candidates.add(candidate);
      }
    }

    Set<String> queryKeywords = KeywordExtractor.extractKeywords(request.queryText());
    List<HybridSearchResult> results =
        HybridScoring.rank(
            candidates,
            queryKeywords,
            request.semanticWeight(),
            request.matchThreshold(),
            request.matchCount());
    log.debug(
        "Hybrid search returned {} of {} candidates (keywords={})",
        results.size(),
        candidates.size(),
        queryKeywords.size());
    return results;
  }

  /**
   * Fetches the chunks whose similarity reaches {@code threshold}. A window the store fills
   * completely may hide further qualifying chunks, so it is doubled and the query repeated until
   * the store returns fewer rows than asked for or the window reaches {@code maxCandidates}.
   */
  private List<EmbeddingMatch<TextSegment>> aboveThreshold(
      Embedding queryEmbedding, @Nullable String sourceType, double threshold, int matchCount) {
    int maxCandidates = properties.getMaxCandidates();
    int window = initialWindow(matchCount, properties.getCandidateMultiplier(), maxCandidates);
    while (true) {
      EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
          EmbeddingSearchRequest.builder()
              .queryEmbedding(queryEmbedding)
              .maxResults(window)
              .minScore(RelevanceScore.fromCosineSimilarity(threshold));
      if (sourceType != null) {
        builder.filter(metadataKey("source_type").isEqualTo(sourceType));
      }
      List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(builder.build()).matches();
      if (matches.size() < window) {
        return matches;
      }
      if (window >= maxCandidates) {
        log.warn("Candidate window capped at {} chunks above threshold {}", window, threshold);
        return matches;
      }
      window = (int) Math.min((long) window * 2, maxCandidates);
    }
  }

  static int initialWindow(int matchCount, int candidateMultiplier, int maxCandidates) {
    return (int) Math.min((long) matchCount * candidateMultiplier, maxCandidates);
  }

  /**
   * Builds a request from optional REST parameters, falling back to the configured defaults.
   */
  public HybridSearchRequest requestFor(
      String queryText,
      @Nullable String sourceType,
      @Nullable Double matchThreshold,
      @Nullable Integer matchCount,
      @Nullable Double semanticWeight) {
    return new HybridSearchRequest(
        queryText,
        sourceType,
        matchThreshold != null ? matchThreshold : properties.getMatchThreshold(),
        matchCount != null ? matchCount : properties.getMatchCount(),
        semanticWeight != null ? semanticWeight : properties.getSemanticWeight());
  }

  private static @Nullable String normalizeSourceType(@Nullable String sourceType) {
    if (sourceType == null || sourceType.isBlank()) {
      return null;
    }
    return IndexSourceType.fromValue(sourceType.trim()).value();
  }

  /** Returns null for chunks that lack the metadata written at indexing time. */
  static HybridScoring.@Nullable Candidate toCandidate(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    if (segment == null) {
      return null;
    }
    Metadata metadata = segment.metadata();
    String type = metadata.getString("source_type");
    String id = metadata.getString("source_id");
    if (type == null || id == null) {
      log.debug("Skipping chunk {} without source metadata", match.embeddingId());
      return null;
    }
    Integer chunkIndex = metadata.getInteger("chunk_index");
    return new HybridScoring.Candidate(
        match.embeddingId(),
        type,
        UUID.fromString(id),
        segment.text(),
        chunkIndex != null ? chunkIndex : 0,
        CosineSimilarity.fromRelevanceScore(match.score()),
        keywordsOf(metadata.getString("keywords")));
  }

  private static Set<String> keywordsOf(@Nullable String joined) {
    if (joined == null || joined.isBlank()) {
      return Set.of();
    }
    return new LinkedHashSet<>(Arrays.asList(joined.trim().split("\\s+")));
  }
}

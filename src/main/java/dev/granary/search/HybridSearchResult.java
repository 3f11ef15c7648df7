package dev.granary.search;

import java.util.UUID;

/**
 * One ranked chunk.
 *
 * @param id embedding id of the chunk
 * @param sourceType {@code announcement} or {@code attachment}
 * @param sourceId id of the catalog record the chunk belongs to
 * @param content chunk text
 * @param chunkIndex position of the chunk within its record
 * @param similarity cosine similarity between query and chunk
 * @param keywordScore share of query keywords present in the chunk
 * @param combinedScore weighted combination used for ranking
 */
public record HybridSearchResult(
    String id,
    String sourceType,
    UUID sourceId,
    String content,
    int chunkIndex,
    double similarity,
    double keywordScore,
    double combinedScore) {}

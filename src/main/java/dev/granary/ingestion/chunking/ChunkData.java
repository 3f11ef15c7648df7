package dev.granary.ingestion.chunking;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One chunk ready for embedding.
 *
 * @param text chunk body text
 * @param sourceType {@code announcement} or {@code attachment}
 * @param sourceId id of the catalog record the chunk belongs to
 * @param chunkIndex position within the record's chunks, from 0
 * @param keywords keyword set of the chunk
 */
public record ChunkData(
    String text, String sourceType, UUID sourceId, int chunkIndex, Set<String> keywords) {

  public ChunkData {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunkIndex must not be negative, got: " + chunkIndex);
    }
    keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
  }

  /**
   * Converts chunk metadata to a langchain4j {@link Metadata} instance with the snake_case keys
   * used by the embedding store. Keywords are stored space-separated.
   */
  public Metadata toMetadata() {
    return Metadata.from("source_type", sourceType)
        .put("source_id", sourceId.toString())
        .put("chunk_index", chunkIndex)
        .put("keywords", String.join(" ", keywords));
  }

  /** Converts this chunk to a langchain4j {@link TextSegment} ready for embedding. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, toMetadata());
  }
}

package dev.granary.ingestion;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.granary.ingestion.chunking.ChunkData;
import dev.granary.ingestion.chunking.KeywordExtractor;
import dev.granary.ingestion.chunking.TextChunker;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maintains the chunks of one catalog record in the embedding store: chunk, extract keywords,
 * embed, then replace the record's previous chunks.
 *
 * <p>All embeddings are computed before the store is touched, so a failing embedding call leaves
 * the previous chunks in place. Deletion and insertion are separate store calls; a reader may
 * briefly see no chunks for the record.
 */
@Service
public class IndexingService {

  private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

  private static final int EMBED_BATCH_SIZE = 256;

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final int chunkSizeWords;
  private final int overlapWords;

  public IndexingService(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      IndexingProperties properties) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.chunkSizeWords = properties.chunkSizeWords();
    this.overlapWords = properties.overlapWords();
  }

  /**
   * Replaces every chunk of a record with chunks of {@code text}.
   *
   * @param sourceType record kind
   * @param sourceId record id
   * @param text full text to index; blank text just removes the record's chunks
   * @return number of chunks stored
   */
  public int replaceChunks(IndexSourceType sourceType, UUID sourceId, String text) {
    List<String> texts = TextChunker.chunkText(text, chunkSizeWords, overlapWords);
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String chunk = texts.get(i);
      segments.add(
          new ChunkData(
                  chunk, sourceType.value(), sourceId, i, KeywordExtractor.extractKeywords(chunk))
              .toTextSegment());
    }
    List<Embedding> embeddings = embed(segments);

    embeddingStore.removeAll(sourceFilter(sourceType, sourceId));
    if (!segments.isEmpty()) {
      embeddingStore.addAll(embeddings, segments);
    }
    log.debug("Indexed {} chunks for {} {}", segments.size(), sourceType.value(), sourceId);
    return segments.size();
  }

  /** Removes every chunk of a record. */
  public void deleteChunks(IndexSourceType sourceType, UUID sourceId) {
    embeddingStore.removeAll(sourceFilter(sourceType, sourceId));
  }

  private List<Embedding> embed(List<TextSegment> segments) {
    List<Embedding> embeddings = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i += EMBED_BATCH_SIZE) {
      List<TextSegment> batch =
          segments.subList(i, Math.min(i + EMBED_BATCH_SIZE, segments.size()));
      embeddings.addAll(embeddingModel.embedAll(batch).content());
    }
    return embeddings;
  }

  static Filter sourceFilter(IndexSourceType sourceType, UUID sourceId) {
    return metadataKey("source_type")
        .isEqualTo(sourceType.value())
        .and(metadataKey("source_id").isEqualTo(sourceId.toString()));
  }
}

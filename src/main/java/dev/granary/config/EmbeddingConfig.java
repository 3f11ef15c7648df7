package dev.granary.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model and vector store beans.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process.
 * The {@link PgVectorEmbeddingStore} runs in plain vector mode: keyword scoring is computed by
 * {@link dev.granary.search.HybridSearchService} from the keyword set stored in each chunk's
 * metadata, so the store's own full-text mode is not used.
 */
@Configuration
public class EmbeddingConfig {

  static final int DIMENSION = 384;

  /**
   * Provides the in-process ONNX embedding model.
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Configures the pgvector embedding store on the shared data source.
   *
   * <p>Table and HNSW index are created by Flyway, so {@code createTable} and {@code useIndex} are
   * disabled. Metadata is one JSONB column.
   *
   * @param dataSource the application's HikariCP data source
   * @return an embedding store over the {@code embedding_chunks} table
   */
  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(DataSource dataSource) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table("embedding_chunks")
        .dimension(DIMENSION)
        .createTable(false)
        .useIndex(false)
        .metadataStorageConfig(
            DefaultMetadataStorageConfig.builder()
                .storageMode(MetadataStorageMode.COMBINED_JSONB)
                .columnDefinitions(List.of("metadata JSONB NULL"))
                .build())
        .build();
  }
}

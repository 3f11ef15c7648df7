package dev.granary;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance with pgvector and cleans the embedding
 * store before each test. Scheduled crawling and re-indexing are pushed out of the test window so
 * tests drive those jobs themselves.
 */
@SpringBootTest(
    properties = {
      "granary.crawl.pending-poll-ms=3600000",
      "granary.crawl.cron=0 0 0 1 1 *",
      "granary.indexing.refresh-interval-ms=3600000",
      "granary.storage.root=target/it-attachments"
    })
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  static {
    postgres.start();
  }

  @Autowired(required = false)
  protected EmbeddingStore<TextSegment> embeddingStore;

  @BeforeEach
  void cleanStore() {
    if (embeddingStore != null) {
      embeddingStore.removeAll();
    }
  }
}

package dev.scriptorium;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.scriptorium.document.CorpusService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance with pgvector and pg_trgm, replaces the
 * Ollama client with the deterministic {@link HashingEmbeddingModel}, disables the cross-encoder,
 * and resets the corpus before each test.
 */
@SpringBootTest(properties = "scriptorium.reranker.enabled=false")
@Import(BaseIntegrationTest.TestEmbeddingConfig.class)
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  static {
    postgres.start();
  }

  @Autowired protected CorpusService corpusService;

  @BeforeEach
  void cleanCorpus() {
    corpusService.deleteAllDocuments();
  }

  @TestConfiguration
  static class TestEmbeddingConfig {

    @Bean
    @Primary
    EmbeddingModel testEmbeddingModel() {
      return new HashingEmbeddingModel(768);
    }
  }
}

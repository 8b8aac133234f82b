package dev.scriptorium.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.scriptorium.ingestion.embedding.EmbeddingProperties;
import dev.scriptorium.search.LazyScoringModel;
import dev.scriptorium.search.RerankerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the model beans used by ingestion and search.
 *
 * <p>Embeddings come from an Ollama server ({@code nomic-embed-text}, 768 dimensions by default);
 * every call is bounded by {@code scriptorium.embedding.timeout}. The cross-encoder for reranking
 * (ms-marco-MiniLM-L-6-v2 exported to ONNX) runs in-process and is only loaded on first use.
 *
 * @see dev.scriptorium.search.SearchService
 */
@Configuration
public class EmbeddingConfig {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

  /**
   * Provides the Ollama-backed embedding model.
   *
   * @param properties endpoint, model name and timeout
   * @return embedding model client
   */
  @Bean
  public EmbeddingModel embeddingModel(EmbeddingProperties properties) {
    log.info(
        "Embedding model: {} at {} (dimension {})",
        properties.getModelName(),
        properties.getBaseUrl(),
        properties.getDimension());
    return OllamaEmbeddingModel.builder()
        .baseUrl(properties.getBaseUrl())
        .modelName(properties.getModelName())
        .timeout(properties.getTimeout())
        .maxRetries(0)
        .build();
  }

  /**
   * Provides the lazily-loaded cross-encoder scoring model. Nothing is read from disk until the
   * first rerank call; the model is released when the context closes.
   *
   * @param properties model and tokenizer paths
   * @return holder that creates the {@link OnnxScoringModel} once
   */
  @Bean(destroyMethod = "close")
  public LazyScoringModel lazyScoringModel(RerankerProperties properties) {
    String modelPath = properties.getModelPath();
    String tokenizerPath = properties.getTokenizerPath();
    return new LazyScoringModel(() -> new OnnxScoringModel(modelPath, tokenizerPath));
  }
}

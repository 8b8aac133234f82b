package dev.scriptorium.ingestion.embedding;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the embedding inference service, bound from {@code
 * scriptorium.embedding.*}.
 *
 * <ul>
 *   <li>{@code base-url} - Ollama endpoint (default http://localhost:11434)
 *   <li>{@code model-name} - embedding model (default nomic-embed-text)
 *   <li>{@code dimension} - system-wide vector dimension, must match the schema (default 768)
 *   <li>{@code batch-size} - chunks per embedding batch (default 50)
 *   <li>{@code timeout} - per-call timeout (default 300s)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.embedding")
public class EmbeddingProperties {

  private String baseUrl = "http://localhost:11434";
  private String modelName = "nomic-embed-text";
  private int dimension = 768;
  private int batchSize = 50;
  private Duration timeout = Duration.ofSeconds(300);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException("scriptorium.embedding.base-url must not be blank");
    }
    if (modelName == null || modelName.isBlank()) {
      throw new IllegalStateException("scriptorium.embedding.model-name must not be blank");
    }
    if (dimension < 1) {
      throw new IllegalStateException(
          "scriptorium.embedding.dimension must be positive, got: " + dimension);
    }
    if (batchSize < 1) {
      throw new IllegalStateException(
          "scriptorium.embedding.batch-size must be at least 1, got: " + batchSize);
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException(
          "scriptorium.embedding.timeout must be positive, got: " + timeout);
    }
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getModelName() {
    return modelName;
  }

  public void setModelName(String modelName) {
    this.modelName = modelName;
  }

  public int getDimension() {
    return dimension;
  }

  public void setDimension(int dimension) {
    this.dimension = dimension;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }
}

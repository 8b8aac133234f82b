package dev.scriptorium.ingestion.chunking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for document chunking, bound from {@code scriptorium.chunking.*}.
 *
 * <ul>
 *   <li>{@code chunk-size} - target window in characters for fixed-size splitting (default 1000)
 *   <li>{@code chunk-overlap} - characters shared between consecutive fixed-size windows (default
 *       200, must be smaller than chunk-size)
 *   <li>{@code max-tokens} - hard upper bound on the estimated tokens of any emitted chunk
 *       (default 512)
 *   <li>{@code min-chunk-chars} - chunks shorter than this are merged into a neighbour (default
 *       100)
 *   <li>{@code semantic-splitting} - split structured documents at heading boundaries (default
 *       true)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.chunking")
public class ChunkingProperties {

  private int chunkSize = 1000;
  private int chunkOverlap = 200;
  private int maxTokens = 512;
  private int minChunkChars = 100;
  private boolean semanticSplitting = true;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (chunkSize < 50) {
      throw new IllegalStateException(
          "scriptorium.chunking.chunk-size must be at least 50, got: " + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalStateException(
          "scriptorium.chunking.chunk-overlap must be in [0, chunk-size), got: " + chunkOverlap);
    }
    if (maxTokens < 16) {
      throw new IllegalStateException(
          "scriptorium.chunking.max-tokens must be at least 16, got: " + maxTokens);
    }
    if (minChunkChars < 0) {
      throw new IllegalStateException(
          "scriptorium.chunking.min-chunk-chars must not be negative, got: " + minChunkChars);
    }
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public void setChunkSize(int chunkSize) {
    this.chunkSize = chunkSize;
  }

  public int getChunkOverlap() {
    return chunkOverlap;
  }

  public void setChunkOverlap(int chunkOverlap) {
    this.chunkOverlap = chunkOverlap;
  }

  public int getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public int getMinChunkChars() {
    return minChunkChars;
  }

  public void setMinChunkChars(int minChunkChars) {
    this.minChunkChars = minChunkChars;
  }

  public boolean isSemanticSplitting() {
    return semanticSplitting;
  }

  public void setSemanticSplitting(boolean semanticSplitting) {
    this.semanticSplitting = semanticSplitting;
  }
}

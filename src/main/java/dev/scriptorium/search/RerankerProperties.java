package dev.scriptorium.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Cross-encoder reranker settings, bound from {@code scriptorium.reranker.*}.
 *
 * <p>{@code candidates} is how many fused results are handed to the reranker; {@code batch-size}
 * bounds the pairs scored per model call. The ONNX Runtime thread counts are read once at startup
 * by {@code OnnxRuntimeConfig}.
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.reranker")
public class RerankerProperties {

  private boolean enabled = true;
  private String modelPath = "models/ms-marco-MiniLM-L-6-v2/model.onnx";
  private String tokenizerPath = "models/ms-marco-MiniLM-L-6-v2/tokenizer.json";
  private int candidates = 30;
  private int batchSize = 32;
  private Duration timeout = Duration.ofSeconds(20);
  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @PostConstruct
  void validate() {
    if (candidates < 1 || candidates > 100) {
      throw new IllegalStateException(
          "scriptorium.reranker.candidates must be in [1, 100], got: " + candidates);
    }
    if (batchSize < 1) {
      throw new IllegalStateException(
          "scriptorium.reranker.batch-size must be at least 1, got: " + batchSize);
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException(
          "scriptorium.reranker.timeout must be positive, got: " + timeout);
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getModelPath() {
    return modelPath;
  }

  public void setModelPath(String modelPath) {
    this.modelPath = modelPath;
  }

  public String getTokenizerPath() {
    return tokenizerPath;
  }

  public void setTokenizerPath(String tokenizerPath) {
    this.tokenizerPath = tokenizerPath;
  }

  public int getCandidates() {
    return candidates;
  }

  public void setCandidates(int candidates) {
    this.candidates = candidates;
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

  public int getIntraOpThreads() {
    return intraOpThreads;
  }

  public void setIntraOpThreads(int intraOpThreads) {
    this.intraOpThreads = intraOpThreads;
  }

  public int getInterOpThreads() {
    return interOpThreads;
  }

  public void setInterOpThreads(int interOpThreads) {
    this.interOpThreads = interOpThreads;
  }
}

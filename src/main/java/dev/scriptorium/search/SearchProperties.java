package dev.scriptorium.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code scriptorium.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code top-k} - results returned when a request names no limit (default 5)
 *   <li>{@code max-limit} - largest limit any caller may ask for (default 50)
 *   <li>{@code similarity-threshold} - minimum cosine similarity for vector hits (default 0.3)
 *   <li>{@code keyword-similarity-threshold} - minimum mean word similarity for fuzzy keyword
 *       hits (default 0.3)
 *   <li>{@code hybrid-enabled} - fuse vector and keyword retrieval; vector only when false
 *       (default true)
 *   <li>{@code vector-weight} / {@code keyword-weight} - fusion weights (default 0.6 / 0.4)
 *   <li>{@code rrf-k} - reciprocal rank fusion constant (default 60)
 *   <li>{@code overfetch-factor} - candidates fetched per channel as a multiple of the limit
 *       (default 3)
 *   <li>{@code fuzzy-enabled} - use pg_trgm fuzzy matching; substring matching only when false
 *       (default true)
 *   <li>{@code substring-fallback-score} - flat score given to substring matches (default 0.5)
 *   <li>{@code degrade-on-channel-failure} - fuse with an empty list when one channel fails,
 *       instead of failing the query (default false)
 *   <li>{@code timeout} - upper bound for each retrieval channel (default 30s)
 *   <li>{@code executor-threads} - worker threads running retrieval channels (default 8)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.search")
public class SearchProperties {

  private int topK = 5;
  private int maxLimit = 50;
  private double similarityThreshold = 0.3;
  private double keywordSimilarityThreshold = 0.3;
  private boolean hybridEnabled = true;
  private double vectorWeight = 0.6;
  private double keywordWeight = 0.4;
  private int rrfK = 60;
  private int overfetchFactor = 3;
  private boolean fuzzyEnabled = true;
  private double substringFallbackScore = 0.5;
  private boolean degradeOnChannelFailure = false;
  private Duration timeout = Duration.ofSeconds(30);
  private int executorThreads = 8;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (topK < 1 || topK > maxLimit) {
      throw new IllegalStateException(
          "scriptorium.search.top-k must be in [1, max-limit], got: " + topK);
    }
    if (similarityThreshold < -1.0 || similarityThreshold > 1.0) {
      throw new IllegalStateException(
          "scriptorium.search.similarity-threshold must be in [-1.0, 1.0], got: "
              + similarityThreshold);
    }
    if (keywordSimilarityThreshold < 0.0 || keywordSimilarityThreshold > 1.0) {
      throw new IllegalStateException(
          "scriptorium.search.keyword-similarity-threshold must be in [0.0, 1.0], got: "
              + keywordSimilarityThreshold);
    }
    if (vectorWeight < 0.0 || keywordWeight < 0.0) {
      throw new IllegalStateException(
          "scriptorium.search fusion weights must not be negative, got: "
              + vectorWeight
              + " / "
              + keywordWeight);
    }
    if (rrfK < 0) {
      throw new IllegalStateException(
          "scriptorium.search.rrf-k must not be negative, got: " + rrfK);
    }
    if (overfetchFactor < 1) {
      throw new IllegalStateException(
          "scriptorium.search.overfetch-factor must be at least 1, got: " + overfetchFactor);
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException(
          "scriptorium.search.timeout must be positive, got: " + timeout);
    }
    if (executorThreads < 2) {
      throw new IllegalStateException(
          "scriptorium.search.executor-threads must be at least 2, got: " + executorThreads);
    }
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  public void setMaxLimit(int maxLimit) {
    this.maxLimit = maxLimit;
  }

  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  public void setSimilarityThreshold(double similarityThreshold) {
    this.similarityThreshold = similarityThreshold;
  }

  public double getKeywordSimilarityThreshold() {
    return keywordSimilarityThreshold;
  }

  public void setKeywordSimilarityThreshold(double keywordSimilarityThreshold) {
    this.keywordSimilarityThreshold = keywordSimilarityThreshold;
  }

  public boolean isHybridEnabled() {
    return hybridEnabled;
  }

  public void setHybridEnabled(boolean hybridEnabled) {
    this.hybridEnabled = hybridEnabled;
  }

  public double getVectorWeight() {
    return vectorWeight;
  }

  public void setVectorWeight(double vectorWeight) {
    this.vectorWeight = vectorWeight;
  }

  public double getKeywordWeight() {
    return keywordWeight;
  }

  public void setKeywordWeight(double keywordWeight) {
    this.keywordWeight = keywordWeight;
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public int getOverfetchFactor() {
    return overfetchFactor;
  }

  public void setOverfetchFactor(int overfetchFactor) {
    this.overfetchFactor = overfetchFactor;
  }

  public boolean isFuzzyEnabled() {
    return fuzzyEnabled;
  }

  public void setFuzzyEnabled(boolean fuzzyEnabled) {
    this.fuzzyEnabled = fuzzyEnabled;
  }

  public double getSubstringFallbackScore() {
    return substringFallbackScore;
  }

  public void setSubstringFallbackScore(double substringFallbackScore) {
    this.substringFallbackScore = substringFallbackScore;
  }

  public boolean isDegradeOnChannelFailure() {
    return degradeOnChannelFailure;
  }

  public void setDegradeOnChannelFailure(boolean degradeOnChannelFailure) {
    this.degradeOnChannelFailure = degradeOnChannelFailure;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public int getExecutorThreads() {
    return executorThreads;
  }

  public void setExecutorThreads(int executorThreads) {
    this.executorThreads = executorThreads;
  }
}

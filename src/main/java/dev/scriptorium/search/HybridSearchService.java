package dev.scriptorium.search;

import dev.scriptorium.document.EmbeddingIntegrityException;
import dev.scriptorium.document.RetrievalUnavailableException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs vector and keyword retrieval concurrently and fuses them with {@link ReciprocalRankFusion}.
 *
 * <p>Each channel is asked for {@code overfetch-factor x limit} candidates so fusion has material
 * from both sides; the fused list is truncated to {@code limit}. Both channels share one deadline
 * of {@code scriptorium.search.timeout}.
 *
 * <p>A failing channel fails the query with {@link RetrievalUnavailableException}. With {@code
 * degrade-on-channel-failure=true} the failing channel is fused as an empty list instead, logged
 * at WARN and reported in {@link HybridSearchResult#degradedChannels()}; when both channels fail
 * the query still fails. A channel that is abandoned (timeout or sibling failure) has its worker
 * interrupted.
 */
@Service
public class HybridSearchService {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

  private final VectorSearchService vectorSearchService;
  private final KeywordSearchService keywordSearchService;
  private final SearchProperties properties;
  private final ExecutorService searchExecutor;

  public HybridSearchService(
      VectorSearchService vectorSearchService,
      KeywordSearchService keywordSearchService,
      SearchProperties properties,
      @Qualifier("searchExecutor") ExecutorService searchExecutor) {
    this.vectorSearchService = vectorSearchService;
    this.keywordSearchService = keywordSearchService;
    this.properties = properties;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Hybrid search with explicit fusion weights.
   *
   * @param queryText the query, for keyword matching
   * @param queryVector the query embedding, for vector matching
   * @param limit maximum fused results, at least 1
   * @param vectorWeight RRF weight of the vector channel
   * @param keywordWeight RRF weight of the keyword channel
   * @return fused results with keyword strategy and degraded channels
   * @throws IllegalArgumentException if limit is below 1 or a weight is negative
   * @throws RetrievalUnavailableException if a channel fails and degradation is off, or if both
   *     channels fail
   */
  public HybridSearchResult search(
      String queryText,
      float[] queryVector,
      int limit,
      double vectorWeight,
      double keywordWeight) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    if (vectorWeight < 0.0 || keywordWeight < 0.0) {
      throw new IllegalArgumentException("weights must not be negative");
    }
    int fetch = Math.multiplyExact(limit, properties.getOverfetchFactor());

    Future<List<SearchResult>> vectorFuture =
        searchExecutor.submit(
            () ->
                vectorSearchService.search(
                    queryVector, fetch, properties.getSimilarityThreshold()));
    Future<KeywordSearchResult> keywordFuture =
        searchExecutor.submit(
            () ->
                keywordSearchService.search(
                    queryText, fetch, properties.getKeywordSimilarityThreshold()));

    long deadline = System.nanoTime() + properties.getTimeout().toNanos();
    Set<SearchChannel> degraded = EnumSet.noneOf(SearchChannel.class);

    List<SearchResult> vectorResults =
        await(vectorFuture, SearchChannel.VECTOR, deadline, degraded, keywordFuture);
    KeywordSearchResult keywordResult =
        await(keywordFuture, SearchChannel.KEYWORD, deadline, degraded, vectorFuture);
    if (degraded.size() == SearchChannel.values().length) {
      throw new RetrievalUnavailableException("Both vector and keyword search failed");
    }

    List<SearchResult> keywordResults = keywordResult == null ? List.of() : keywordResult.results();
    List<SearchResult> fused =
        ReciprocalRankFusion.fuse(
            vectorResults == null ? List.of() : vectorResults,
            keywordResults,
            properties.getRrfK(),
            vectorWeight,
            keywordWeight);
    List<SearchResult> truncated = fused.size() > limit ? fused.subList(0, limit) : fused;

    log.info(
        "Hybrid search: vector={}, keyword={} ({}), fused={}, returned={}",
        vectorResults == null ? "failed" : vectorResults.size(),
        keywordResult == null ? "failed" : keywordResults.size(),
        keywordResult == null ? "-" : keywordResult.strategy(),
        fused.size(),
        truncated.size());
    return new HybridSearchResult(
        truncated, keywordResult == null ? null : keywordResult.strategy(), degraded);
  }

  /** Hybrid search with the configured default weights. */
  public HybridSearchResult search(String queryText, float[] queryVector, int limit) {
    return search(
        queryText,
        queryVector,
        limit,
        properties.getVectorWeight(),
        properties.getKeywordWeight());
  }

  /**
   * Waits for a channel until the shared deadline. Returns null for a channel that failed under
   * degradation; otherwise a failure cancels the sibling channel and is thrown.
   */
  private <T> @Nullable T await(
      Future<T> future,
      SearchChannel channel,
      long deadline,
      Set<SearchChannel> degraded,
      Future<?> sibling) {
    RuntimeException failure;
    try {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      failure =
          new RetrievalUnavailableException(
              channel + " search timed out after " + properties.getTimeout(), e);
    } catch (ExecutionException e) {
      failure = toRuntime(channel, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      sibling.cancel(true);
      throw new RetrievalUnavailableException(channel + " search interrupted", e);
    }

    if (isCallerError(failure) || !properties.isDegradeOnChannelFailure()) {
      sibling.cancel(true);
      throw failure;
    }
    log.warn("{} search failed, continuing without it: {}", channel, failure.getMessage());
    degraded.add(channel);
    return null;
  }

  private static boolean isCallerError(RuntimeException failure) {
    return failure instanceof IllegalArgumentException
        || failure instanceof EmbeddingIntegrityException;
  }

  private static RuntimeException toRuntime(SearchChannel channel, @Nullable Throwable cause) {
    if (cause instanceof RetrievalUnavailableException
        || cause instanceof IllegalArgumentException
        || cause instanceof EmbeddingIntegrityException) {
      return (RuntimeException) cause;
    }
    String detail = cause == null ? "unknown error" : cause.getMessage();
    return new RetrievalUnavailableException(channel + " search failed: " + detail, cause);
  }
}

package dev.scriptorium.search;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
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
 * Cross-encoder reranking that re-scores search candidates using an ONNX scoring model
 * (ms-marco-MiniLM-L-6-v2).
 *
 * <p>Each (query, candidate content) pair is scored independently; pairs are sent to the model in
 * batches of {@code scriptorium.reranker.batch-size}, and batch boundaries do not change any pair's
 * score. The new score replaces {@code similarity}, results are re-sorted descending (stable) and
 * truncated to {@code topK}.
 *
 * <p>Reranking is best effort. {@link #score} reports model-load, inference and timeout failures as
 * a {@link RetrievalOutcome} failure; {@link #rerank} turns any failure into the unchanged input.
 * A timed-out scoring run is interrupted so it releases its executor thread.
 * An empty candidate list never touches the model.
 */
@Service
public class RerankerService {

  private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

  private final LazyScoringModel scoringModel;
  private final RerankerProperties properties;
  private final ExecutorService searchExecutor;

  public RerankerService(
      LazyScoringModel scoringModel,
      RerankerProperties properties,
      @Qualifier("searchExecutor") ExecutorService searchExecutor) {
    this.scoringModel = scoringModel;
    this.properties = properties;
    this.searchExecutor = searchExecutor;
  }

  public boolean isEnabled() {
    return properties.isEnabled();
  }

  /**
   * Rescores candidates, falling back to the input list on any failure.
   *
   * @param query the original query text
   * @param candidates results to rescore, in their current order
   * @param topK maximum results to keep, null for all
   * @return rescored results, or {@code candidates} itself if reranking failed
   */
  public List<SearchResult> rerank(
      String query, List<SearchResult> candidates, @Nullable Integer topK) {
    RetrievalOutcome<List<SearchResult>> outcome = score(query, candidates, topK);
    if (!outcome.isSuccess()) {
      log.warn(
          "Reranking skipped ({}: {}), returning {} candidates in original order",
          outcome.reason(),
          outcome.detail(),
          candidates.size());
      return candidates;
    }
    return outcome.value();
  }

  /**
   * Rescores candidates, reporting failure explicitly.
   *
   * @param query the original query text
   * @param candidates results to rescore
   * @param topK maximum results to keep, null for all
   * @return rescored results sorted descending, or a tagged failure
   * @throws IllegalArgumentException if topK is below 1
   */
  public RetrievalOutcome<List<SearchResult>> score(
      String query, List<SearchResult> candidates, @Nullable Integer topK) {
    if (topK != null && topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1");
    }
    if (candidates.isEmpty()) {
      return RetrievalOutcome.success(candidates);
    }
    if (!properties.isEnabled()) {
      return RetrievalOutcome.failure(FailureReason.DISABLED, "reranker disabled");
    }

    ScoringModel model;
    try {
      model = scoringModel.get();
    } catch (RuntimeException e) {
      log.error("Failed to load reranker model", e);
      return RetrievalOutcome.failure(FailureReason.MODEL_LOAD, e.getMessage());
    }

    long start = System.nanoTime();
    List<Double> scores;
    Future<List<Double>> future =
        searchExecutor.submit(() -> scoreInBatches(model, query, candidates));
    try {
      scores = future.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return RetrievalOutcome.failure(
          FailureReason.TIMEOUT, "reranking exceeded " + properties.getTimeout());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      log.error("Reranking failed", cause);
      return RetrievalOutcome.failure(FailureReason.INFERENCE, cause.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return RetrievalOutcome.failure(FailureReason.INFERENCE, "reranking interrupted");
    }

    List<SearchResult> rescored = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      rescored.add(candidates.get(i).withSimilarity(scores.get(i)));
    }
    rescored.sort(Comparator.comparingDouble(SearchResult::similarity).reversed());
    List<SearchResult> kept =
        topK != null && rescored.size() > topK ? rescored.subList(0, topK) : rescored;

    log.info(
        "Reranked {} candidates in {} ms, top score {}",
        candidates.size(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start),
        String.format("%.4f", kept.get(0).similarity()));
    return RetrievalOutcome.success(List.copyOf(kept));
  }

  private List<Double> scoreInBatches(
      ScoringModel model, String query, List<SearchResult> candidates) {
    int batchSize = properties.getBatchSize();
    List<Double> scores = new ArrayList<>(candidates.size());
    for (int start = 0; start < candidates.size(); start += batchSize) {
      List<TextSegment> segments =
          candidates.subList(start, Math.min(start + batchSize, candidates.size())).stream()
              .map(c -> TextSegment.from(c.content()))
              .toList();
      Response<List<Double>> response = model.scoreAll(segments, query);
      List<Double> batchScores = response == null ? null : response.content();
      if (batchScores == null || batchScores.size() != segments.size()) {
        throw new IllegalStateException(
            "Scoring model returned "
                + (batchScores == null ? 0 : batchScores.size())
                + " scores for "
                + segments.size()
                + " pairs");
      }
      scores.addAll(batchScores);
    }
    return scores;
  }
}

package dev.scriptorium.search;

import dev.scriptorium.document.RetrievalUnavailableException;
import dev.scriptorium.ingestion.embedding.ChunkEmbedder;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: embed the query, retrieve (hybrid or vector only), optionally rerank, and
 * truncate to the requested limit.
 *
 * <p>Pipeline: validate -> embed query (failure is fatal) -> retrieve {@code reranker.candidates}
 * results when reranking, otherwise {@code limit} -> cross-encoder rerank (best effort) -> top
 * {@code limit}. The response says which keyword strategy ran, whether the reranker scores are
 * final, and which channels were degraded.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final ChunkEmbedder embedder;
  private final VectorSearchService vectorSearchService;
  private final HybridSearchService hybridSearchService;
  private final RerankerService rerankerService;
  private final SearchProperties searchProperties;
  private final RerankerProperties rerankerProperties;

  public SearchService(
      ChunkEmbedder embedder,
      VectorSearchService vectorSearchService,
      HybridSearchService hybridSearchService,
      RerankerService rerankerService,
      SearchProperties searchProperties,
      RerankerProperties rerankerProperties) {
    this.embedder = embedder;
    this.vectorSearchService = vectorSearchService;
    this.hybridSearchService = hybridSearchService;
    this.rerankerService = rerankerService;
    this.searchProperties = searchProperties;
    this.rerankerProperties = rerankerProperties;
  }

  /**
   * Runs a query end to end.
   *
   * @param request the query and its options
   * @return ranked results with provenance flags
   * @throws IllegalArgumentException if the limit exceeds {@code max-limit}
   * @throws RetrievalUnavailableException if the query cannot be embedded or a channel fails
   */
  public SearchResponse search(SearchRequest request) {
    int limit = resolveLimit(request.limit());
    boolean hybrid =
        request.hybrid() != null ? request.hybrid() : searchProperties.isHybridEnabled();
    boolean rerank = request.rerank() != null ? request.rerank() : rerankerService.isEnabled();
    int fetch = rerank ? Math.max(limit, rerankerProperties.getCandidates()) : limit;

    log.info(
        "Search '{}': limit={}, hybrid={}, rerank={}",
        KeywordSearchService.abbreviate(request.query()),
        limit,
        hybrid,
        rerank);

    float[] queryVector = embedder.embedQuery(request.query());

    List<SearchResult> candidates;
    KeywordStrategy keywordStrategy = null;
    Set<SearchChannel> degraded = Set.of();
    if (hybrid) {
      HybridSearchResult result = hybridSearchService.search(request.query(), queryVector, fetch);
      candidates = result.results();
      keywordStrategy = result.keywordStrategy();
      degraded = result.degradedChannels();
    } else {
      candidates =
          vectorSearchService.search(queryVector, fetch, searchProperties.getSimilarityThreshold());
    }

    boolean reranked = false;
    List<SearchResult> results = candidates;
    if (rerank && !candidates.isEmpty()) {
      RetrievalOutcome<List<SearchResult>> outcome =
          rerankerService.score(request.query(), candidates, limit);
      if (outcome.isSuccess()) {
        results = outcome.value();
        reranked = true;
      } else {
        log.warn(
            "Reranking unavailable ({}: {}), keeping retrieval order",
            outcome.reason(),
            outcome.detail());
      }
    }
    if (results.size() > limit) {
      results = results.subList(0, limit);
    }
    return new SearchResponse(results, keywordStrategy, reranked, degraded);
  }

  /**
   * Runs a query and formats its results as a generation context string.
   *
   * @return numbered source blocks, or a fixed message when nothing was found
   */
  public String buildContext(SearchRequest request) {
    return ContextFormatter.format(search(request).results());
  }

  private int resolveLimit(@Nullable Integer requested) {
    int limit = requested != null ? requested : searchProperties.getTopK();
    if (limit > searchProperties.getMaxLimit()) {
      throw new IllegalArgumentException(
          "limit must be at most " + searchProperties.getMaxLimit() + ", got: " + limit);
    }
    return limit;
  }
}

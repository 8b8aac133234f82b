package dev.scriptorium.search;

import org.jspecify.annotations.Nullable;

/**
 * Domain request for a retrieval query.
 *
 * @param query the search query text (must not be null or blank)
 * @param limit maximum results; null means {@code scriptorium.search.top-k}
 * @param hybrid fuse vector and keyword retrieval; null means {@code hybrid-enabled}
 * @param rerank apply the cross-encoder; null means {@code scriptorium.reranker.enabled}
 */
public record SearchRequest(
    String query, @Nullable Integer limit, @Nullable Boolean hybrid, @Nullable Boolean rerank) {

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit != null && limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
  }

  /** Query with configured defaults for everything else. */
  public SearchRequest(String query) {
    this(query, null, null, null);
  }

  /** Query and limit, configured defaults for the rest. */
  public SearchRequest(String query, int limit) {
    this(query, limit, null, null);
  }
}

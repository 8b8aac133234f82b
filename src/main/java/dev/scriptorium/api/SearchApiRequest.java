package dev.scriptorium.api;

import dev.scriptorium.search.SearchRequest;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/search}.
 *
 * @param query search text, required
 * @param limit results to return, 1..20, default 5
 * @param hybrid override hybrid retrieval, null for the configured default
 * @param rerank override reranking, null for the configured default
 */
public record SearchApiRequest(
    String query, @Nullable Integer limit, @Nullable Boolean hybrid, @Nullable Boolean rerank) {

  static final int DEFAULT_LIMIT = 5;
  static final int MAX_LIMIT = 20;

  public SearchApiRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
  }

  SearchRequest toSearchRequest() {
    return new SearchRequest(query, limit != null ? limit : DEFAULT_LIMIT, hybrid, rerank);
  }
}

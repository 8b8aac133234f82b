package dev.scriptorium.api;

import dev.scriptorium.search.KeywordStrategy;
import dev.scriptorium.search.SearchChannel;
import dev.scriptorium.search.SearchResponse;
import dev.scriptorium.search.SearchResult;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Body returned by {@code POST /api/search}. */
public record SearchApiResponse(
    List<SearchResult> results,
    int totalResults,
    @Nullable KeywordStrategy keywordStrategy,
    boolean reranked,
    Set<SearchChannel> degradedChannels) {

  static SearchApiResponse from(SearchResponse response) {
    return new SearchApiResponse(
        response.results(),
        response.results().size(),
        response.keywordStrategy(),
        response.reranked(),
        response.degradedChannels());
  }
}

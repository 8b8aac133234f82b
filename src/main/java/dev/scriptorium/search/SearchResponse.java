package dev.scriptorium.search;

import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Ranked results of one query plus how they were produced.
 *
 * @param results final results, best first
 * @param keywordStrategy keyword strategy used, null for vector-only search or a degraded keyword
 *     channel
 * @param reranked true if the cross-encoder scores are the final {@code similarity} values
 * @param degradedChannels hybrid channels that failed and were left out
 */
public record SearchResponse(
    List<SearchResult> results,
    @Nullable KeywordStrategy keywordStrategy,
    boolean reranked,
    Set<SearchChannel> degradedChannels) {

  public SearchResponse {
    results = List.copyOf(results);
    degradedChannels = Set.copyOf(degradedChannels);
  }
}

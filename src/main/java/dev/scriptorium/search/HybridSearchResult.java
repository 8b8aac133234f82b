package dev.scriptorium.search;

import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Output of {@link HybridSearchService}.
 *
 * @param results fused results, RRF score descending
 * @param keywordStrategy strategy the keyword channel used, null if that channel failed
 * @param degradedChannels channels that failed and were fused as empty lists
 */
public record HybridSearchResult(
    List<SearchResult> results,
    @Nullable KeywordStrategy keywordStrategy,
    Set<SearchChannel> degradedChannels) {

  public HybridSearchResult {
    results = List.copyOf(results);
    degradedChannels = Set.copyOf(degradedChannels);
  }
}

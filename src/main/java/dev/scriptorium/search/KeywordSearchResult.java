package dev.scriptorium.search;

import java.util.List;
import java.util.Objects;

/**
 * Keyword matches together with the strategy that produced them. Scores are only comparable
 * within one strategy: fuzzy scores are graded, substring scores are flat.
 *
 * @param results matches, relevance descending
 * @param strategy the strategy that ran
 */
public record KeywordSearchResult(List<SearchResult> results, KeywordStrategy strategy) {

  public KeywordSearchResult {
    results = List.copyOf(results);
    Objects.requireNonNull(strategy, "strategy must not be null");
  }

  static KeywordSearchResult empty() {
    return new KeywordSearchResult(List.of(), KeywordStrategy.NONE);
  }
}

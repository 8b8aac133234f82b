package dev.scriptorium.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pure static utility merging two ranked result lists with weighted Reciprocal Rank Fusion.
 *
 * <p>A result at 0-based rank {@code r} in a list contributes {@code weight / (k + r + 1)}. A chunk
 * present in both lists receives the sum of its two contributions and keeps the {@link
 * SearchResult} of its first occurrence (list A is read before list B). The output is sorted by
 * fused score descending with a stable sort, so equal scores keep first-seen order, and each
 * result's {@code similarity} is replaced by its fused score.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class ReciprocalRankFusion {

  /** Rank constant from the original RRF paper. */
  public static final int DEFAULT_K = 60;

  private ReciprocalRankFusion() {}

  /**
   * Fuses two ranked lists.
   *
   * @param listA first ranking, best first
   * @param listB second ranking, best first
   * @param k rank constant, non-negative; larger values flatten the curve
   * @param weightA weight of list A, non-negative
   * @param weightB weight of list B, non-negative
   * @return fused results, score descending, ties in first-seen order
   * @throws IllegalArgumentException if k or a weight is negative
   */
  public static List<SearchResult> fuse(
      List<SearchResult> listA, List<SearchResult> listB, int k, double weightA, double weightB) {
    if (k < 0) {
      throw new IllegalArgumentException("k must not be negative, got: " + k);
    }
    if (weightA < 0.0 || weightB < 0.0) {
      throw new IllegalArgumentException(
          "weights must not be negative, got: " + weightA + " / " + weightB);
    }

    Map<UUID, FusedEntry> fused = new LinkedHashMap<>();
    accumulate(fused, listA, k, weightA);
    accumulate(fused, listB, k, weightB);

    List<FusedEntry> entries = new ArrayList<>(fused.values());
    // List.sort is stable: equal scores keep insertion order
    entries.sort(Comparator.comparingDouble(FusedEntry::score).reversed());
    return entries.stream().map(e -> e.result().withSimilarity(e.score())).toList();
  }

  /** Contribution of a single rank position. */
  static double contribution(int rank, int k, double weight) {
    return weight / (k + rank + 1);
  }

  private static void accumulate(
      Map<UUID, FusedEntry> fused, List<SearchResult> ranking, int k, double weight) {
    for (int rank = 0; rank < ranking.size(); rank++) {
      SearchResult result = ranking.get(rank);
      double score = contribution(rank, k, weight);
      fused.merge(
          result.chunkId(),
          new FusedEntry(result, score),
          (existing, added) -> new FusedEntry(existing.result(), existing.score() + added.score()));
    }
  }

  private record FusedEntry(SearchResult result, double score) {}
}

package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.scriptorium.fixture.SearchResultBuilder;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

/** Invariants of weighted RRF that hold for any pair of rankings. */
class ReciprocalRankFusionPropertyTest {

  @Provide
  Arbitrary<List<SearchResult>> rankings() {
    return Arbitraries.strings()
        .withCharRange('a', 'h')
        .ofLength(1)
        .list()
        .uniqueElements()
        .ofMaxSize(8)
        .map(keys -> keys.stream().map(key -> SearchResultBuilder.result(key, 0.5)).toList());
  }

  @Property
  void everyInputItemAppearsExactlyOnce(
      @ForAll("rankings") List<SearchResult> listA,
      @ForAll("rankings") List<SearchResult> listB,
      @ForAll @IntRange(min = 0, max = 100) int k) {
    List<SearchResult> fused = ReciprocalRankFusion.fuse(listA, listB, k, 0.5, 0.5);

    Set<UUID> expected = new HashSet<>();
    listA.forEach(r -> expected.add(r.chunkId()));
    listB.forEach(r -> expected.add(r.chunkId()));
    assertThat(fused).extracting(SearchResult::chunkId).doesNotHaveDuplicates();
    assertThat(fused)
        .extracting(SearchResult::chunkId)
        .containsExactlyInAnyOrderElementsOf(expected);
  }

  @Property
  void scoresAreNonIncreasing(
      @ForAll("rankings") List<SearchResult> listA,
      @ForAll("rankings") List<SearchResult> listB,
      @ForAll @DoubleRange(min = 0.0, max = 2.0) double weightA,
      @ForAll @DoubleRange(min = 0.0, max = 2.0) double weightB) {
    List<SearchResult> fused = ReciprocalRankFusion.fuse(listA, listB, 60, weightA, weightB);

    for (int i = 1; i < fused.size(); i++) {
      assertThat(fused.get(i).similarity()).isLessThanOrEqualTo(fused.get(i - 1).similarity());
    }
  }

  @Property
  void totalScoreEqualsSumOfContributions(
      @ForAll("rankings") List<SearchResult> listA,
      @ForAll("rankings") List<SearchResult> listB) {
    List<SearchResult> fused = ReciprocalRankFusion.fuse(listA, listB, 60, 0.7, 0.3);

    double expected = 0.0;
    for (int rank = 0; rank < listA.size(); rank++) {
      expected += ReciprocalRankFusion.contribution(rank, 60, 0.7);
    }
    for (int rank = 0; rank < listB.size(); rank++) {
      expected += ReciprocalRankFusion.contribution(rank, 60, 0.3);
    }
    double actual = fused.stream().mapToDouble(SearchResult::similarity).sum();
    assertThat(actual).isCloseTo(expected, within(1e-9));
  }
}

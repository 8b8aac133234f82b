package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.scriptorium.BaseIntegrationTest;
import dev.scriptorium.HashingEmbeddingModel;
import dev.scriptorium.ingestion.IngestionService;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SearchIT extends BaseIntegrationTest {

  private static final String CATS =
      "Cats are small domesticated mammals. Cats purr when they are content.";
  private static final String DOGS =
      "Dogs are loyal companions. Dogs enjoy long walks and playing fetch.";

  private final HashingEmbeddingModel queryModel = new HashingEmbeddingModel(768);

  @Autowired IngestionService ingestionService;
  @Autowired VectorSearchService vectorSearchService;
  @Autowired KeywordSearchService keywordSearchService;
  @Autowired HybridSearchService hybridSearchService;
  @Autowired SearchService searchService;
  @Autowired SearchProperties searchProperties;

  @BeforeEach
  void seedCorpus() {
    ingestionService.ingestUpload("cats.md", CATS.getBytes(StandardCharsets.UTF_8));
    ingestionService.ingestUpload("dogs.md", DOGS.getBytes(StandardCharsets.UTF_8));
  }

  private float[] vectorOf(String text) {
    return queryModel.embedText(text).vector();
  }

  @Test
  void vectorSearchFindsTheClosestChunk() {
    List<SearchResult> results = vectorSearchService.search(vectorOf("cats"), 1, 0.0);

    assertThat(results)
        .singleElement()
        .satisfies(
            result -> {
              assertThat(result.content()).isEqualTo(CATS);
              assertThat(result.similarity()).isGreaterThan(0.0);
              assertThat(result.documentTitle()).isEqualTo("cats");
              assertThat(result.documentSource()).isEqualTo("cats.md");
            });
  }

  @Test
  void vectorThresholdFiltersWeakMatches() {
    List<SearchResult> results = vectorSearchService.search(vectorOf("cats"), 10, 0.3);

    assertThat(results).extracting(SearchResult::content).containsExactly(CATS);
    assertThat(results).allSatisfy(r -> assertThat(r.similarity()).isGreaterThanOrEqualTo(0.3));
  }

  @Test
  void fuzzyKeywordSearchToleratesMisspelling() {
    KeywordSearchResult result = keywordSearchService.search("dogz", 5, 0.5);

    assertThat(result.strategy()).isEqualTo(KeywordStrategy.FUZZY);
    assertThat(result.results()).extracting(SearchResult::content).containsExactly(DOGS);
  }

  @Test
  void stopWordQueryFindsNothing() {
    KeywordSearchResult result = keywordSearchService.search("the that which", 5);

    assertThat(result.results()).isEmpty();
    assertThat(result.strategy()).isEqualTo(KeywordStrategy.NONE);
  }

  @Test
  void substringMatchingWhenFuzzyIsDisabled() {
    searchProperties.setFuzzyEnabled(false);
    try {
      KeywordSearchResult result = keywordSearchService.search("fetch", 5);

      assertThat(result.strategy()).isEqualTo(KeywordStrategy.SUBSTRING);
      assertThat(result.results())
          .singleElement()
          .satisfies(
              r -> {
                assertThat(r.content()).isEqualTo(DOGS);
                assertThat(r.similarity())
                    .isEqualTo(searchProperties.getSubstringFallbackScore());
              });
    } finally {
      searchProperties.setFuzzyEnabled(true);
    }
  }

  @Test
  void boostedKeywordWeightPutsTheKeywordMatchFirst() {
    HybridSearchResult result =
        hybridSearchService.search("dogs fetch", vectorOf("cats mammals"), 2, 0.1, 1.0);

    assertThat(result.results()).extracting(SearchResult::content).first().isEqualTo(DOGS);
    assertThat(result.keywordStrategy()).isEqualTo(KeywordStrategy.FUZZY);
    assertThat(result.degradedChannels()).isEmpty();
  }

  @Test
  void searchServiceRunsTheFullPipeline() {
    SearchResponse response = searchService.search(new SearchRequest("why do cats purr", 1));

    assertThat(response.results()).extracting(SearchResult::content).containsExactly(CATS);
    assertThat(response.reranked()).isFalse();
    assertThat(searchService.buildContext(new SearchRequest("why do cats purr", 1)))
        .isEqualTo("[Source 1: cats]\n" + CATS);
  }
}

package dev.scriptorium.search;

import static dev.scriptorium.fixture.SearchResultBuilder.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.scriptorium.document.RetrievalUnavailableException;
import dev.scriptorium.ingestion.embedding.ChunkEmbedder;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {

  private static final float[] QUERY_VECTOR = {0.1f, 0.2f};

  @Mock ChunkEmbedder embedder;
  @Mock VectorSearchService vectorSearchService;
  @Mock HybridSearchService hybridSearchService;
  @Mock RerankerService rerankerService;

  private SearchProperties searchProperties;
  private RerankerProperties rerankerProperties;
  private SearchService service;

  @BeforeEach
  void setUp() {
    searchProperties = new SearchProperties();
    searchProperties.setTopK(2);
    searchProperties.setMaxLimit(10);
    searchProperties.setSimilarityThreshold(0.3);
    rerankerProperties = new RerankerProperties();
    rerankerProperties.setCandidates(20);
    service =
        new SearchService(
            embedder,
            vectorSearchService,
            hybridSearchService,
            rerankerService,
            searchProperties,
            rerankerProperties);
  }

  private void givenHybrid(List<SearchResult> results) {
    given(hybridSearchService.search(eq("pets"), eq(QUERY_VECTOR), anyInt()))
        .willReturn(new HybridSearchResult(results, KeywordStrategy.FUZZY, Set.of()));
  }

  @Test
  void hybridAndRerankByDefaultWithCandidateFetch() {
    List<SearchResult> candidates = List.of(result("cats", 0.02), result("dogs", 0.01));
    List<SearchResult> reranked = List.of(result("dogs", 0.95), result("cats", 0.40));
    given(embedder.embedQuery("pets")).willReturn(QUERY_VECTOR);
    given(rerankerService.isEnabled()).willReturn(true);
    givenHybrid(candidates);
    given(rerankerService.score("pets", candidates, 2))
        .willReturn(RetrievalOutcome.success(reranked));

    SearchResponse response = service.search(new SearchRequest("pets"));

    verify(hybridSearchService).search("pets", QUERY_VECTOR, 20);
    assertThat(response.results()).isEqualTo(reranked);
    assertThat(response.reranked()).isTrue();
    assertThat(response.keywordStrategy()).isEqualTo(KeywordStrategy.FUZZY);
  }

  @Test
  void rerankFailureKeepsRetrievalOrderTruncatedToLimit() {
    List<SearchResult> candidates =
        List.of(result("a", 0.3), result("b", 0.2), result("c", 0.1));
    given(embedder.embedQuery("pets")).willReturn(QUERY_VECTOR);
    given(rerankerService.isEnabled()).willReturn(true);
    givenHybrid(candidates);
    given(rerankerService.score("pets", candidates, 2))
        .willReturn(RetrievalOutcome.failure(FailureReason.MODEL_LOAD, "missing"));

    SearchResponse response = service.search(new SearchRequest("pets"));

    assertThat(response.results()).extracting(SearchResult::content).containsExactly("a", "b");
    assertThat(response.reranked()).isFalse();
  }

  @Test
  void vectorOnlyWithoutRerankUsesSimilarityThreshold() {
    given(embedder.embedQuery("pets")).willReturn(QUERY_VECTOR);
    given(vectorSearchService.search(QUERY_VECTOR, 3, 0.3))
        .willReturn(List.of(result("cats", 0.8)));

    SearchResponse response = service.search(new SearchRequest("pets", 3, false, false));

    assertThat(response.results()).extracting(SearchResult::content).containsExactly("cats");
    assertThat(response.keywordStrategy()).isNull();
    assertThat(response.degradedChannels()).isEmpty();
    verifyNoInteractions(hybridSearchService);
    verify(rerankerService, never()).score(any(), any(), any());
  }

  @Test
  void emptyCandidatesSkipReranking() {
    given(embedder.embedQuery("pets")).willReturn(QUERY_VECTOR);
    givenHybrid(List.of());

    SearchResponse response = service.search(new SearchRequest("pets", 2, true, true));

    assertThat(response.results()).isEmpty();
    assertThat(response.reranked()).isFalse();
    verify(rerankerService, never()).score(any(), any(), any());
  }

  @Test
  void degradedChannelsAreReported() {
    given(embedder.embedQuery("pets")).willReturn(QUERY_VECTOR);
    given(hybridSearchService.search(eq("pets"), eq(QUERY_VECTOR), anyInt()))
        .willReturn(
            new HybridSearchResult(
                List.of(result("cats", 0.01)), null, Set.of(SearchChannel.KEYWORD)));

    SearchResponse response = service.search(new SearchRequest("pets", 2, true, false));

    assertThat(response.degradedChannels()).containsExactly(SearchChannel.KEYWORD);
    assertThat(response.keywordStrategy()).isNull();
  }

  @Test
  void limitAboveMaximumIsRejected() {
    assertThatThrownBy(() -> service.search(new SearchRequest("pets", 11)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("at most 10");
    verifyNoInteractions(embedder);
  }

  @Test
  void embeddingFailureMeansUnavailable() {
    given(embedder.embedQuery("pets"))
        .willThrow(new RetrievalUnavailableException("Query embedding failed: timeout"));

    assertThatThrownBy(() -> service.search(new SearchRequest("pets", 2, true, false)))
        .isInstanceOf(RetrievalUnavailableException.class);
  }

  @Test
  void buildContextFormatsResults() {
    given(embedder.embedQuery("pets")).willReturn(QUERY_VECTOR);
    given(vectorSearchService.search(QUERY_VECTOR, 2, 0.3))
        .willReturn(List.of(result("Cats purr.", 0.8)));

    String context = service.buildContext(new SearchRequest("pets", 2, false, false));

    assertThat(context).isEqualTo("[Source 1: Intro]\nCats purr.");
  }
}

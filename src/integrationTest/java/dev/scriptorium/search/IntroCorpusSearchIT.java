package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.scriptorium.BaseIntegrationTest;
import dev.scriptorium.HashingEmbeddingModel;
import dev.scriptorium.document.MetadataKeys;
import dev.scriptorium.document.NewChunk;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/** One document "Intro" with two short, separately embedded chunks. */
class IntroCorpusSearchIT extends BaseIntegrationTest {

  private static final String CATS = "cats are mammals";
  private static final String DOGS = "dogs are mammals too";

  private final HashingEmbeddingModel model = new HashingEmbeddingModel(768);

  @Autowired VectorSearchService vectorSearchService;
  @Autowired HybridSearchService hybridSearchService;

  @BeforeEach
  void seedIntro() {
    corpusService.createDocument(
        "Intro",
        "intro.md",
        CATS + "\n\n" + DOGS,
        Map.of(),
        List.of(chunk(CATS, 0), chunk(DOGS, 1)));
  }

  private NewChunk chunk(String content, int index) {
    return new NewChunk(
        content, index, 5, Map.of(MetadataKeys.CHUNK_METHOD, "fixed_size"), vectorOf(content));
  }

  private float[] vectorOf(String text) {
    return model.embedText(text).vector();
  }

  private static double cosine(float[] a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  @Test
  void closestChunkIsReturnedWithItsCosineSimilarity() {
    float[] query = vectorOf("what are cats");

    List<SearchResult> results = vectorSearchService.search(query, 1, 0.0);

    assertThat(results)
        .singleElement()
        .satisfies(
            result -> {
              assertThat(result.content()).isEqualTo(CATS);
              assertThat(result.documentTitle()).isEqualTo("Intro");
              assertThat(result.similarity())
                  .isGreaterThan(0.0)
                  .isCloseTo(cosine(query, vectorOf(CATS)), within(1e-4));
            });
  }

  @Test
  void boostedKeywordWeightRanksTheDogChunkFirst() {
    HybridSearchResult result =
        hybridSearchService.search("dogs", vectorOf("what are cats"), 2, 0.1, 1.0);

    assertThat(result.results()).extracting(SearchResult::content).first().isEqualTo(DOGS);
  }
}

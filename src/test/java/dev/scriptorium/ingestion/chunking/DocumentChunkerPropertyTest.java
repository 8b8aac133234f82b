package dev.scriptorium.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link DocumentChunker} invariants that must hold for any text and any
 * valid configuration: the token bound, contiguous indexes, non-blank content and determinism.
 */
class DocumentChunkerPropertyTest {

  @Provide
  Arbitrary<String> documents() {
    Arbitrary<String> heading =
        Combinators.combine(
                Arbitraries.of("# ", "## ", "### ", "#### "),
                Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(12))
            .as((marker, text) -> marker + text);
    Arbitrary<String> paragraph =
        Arbitraries.strings()
            .withChars("abcdefghij .,!?")
            .ofMinLength(0)
            .ofMaxLength(900);
    Arbitrary<String> block = Arbitraries.oneOf(heading, paragraph, paragraph);
    return block.list().ofMaxSize(12).map(blocks -> String.join("\n\n", blocks));
  }

  @Provide
  Arbitrary<ChunkingProperties> configurations() {
    return Combinators.combine(
            Arbitraries.integers().between(50, 1200),
            Arbitraries.integers().between(0, 99),
            Arbitraries.integers().between(16, 300),
            Arbitraries.integers().between(0, 200),
            Arbitraries.of(true, false))
        .as(
            (size, overlapPercent, maxTokens, minChars, semantic) -> {
              ChunkingProperties properties = new ChunkingProperties();
              properties.setChunkSize(size);
              properties.setChunkOverlap(size * overlapPercent / 100);
              properties.setMaxTokens(maxTokens);
              properties.setMinChunkChars(minChars);
              properties.setSemanticSplitting(semantic);
              properties.validate();
              return properties;
            });
  }

  @Property
  void everyChunkRespectsTheTokenBound(
      @ForAll("documents") String text,
      @ForAll("configurations") ChunkingProperties properties) {
    List<ChunkDraft> chunks = new DocumentChunker(properties).chunk(text, "t", "s", null);

    assertThat(chunks)
        .allSatisfy(
            chunk -> {
              assertThat(chunk.tokenCount()).isLessThanOrEqualTo(properties.getMaxTokens());
              assertThat(chunk.tokenCount()).isEqualTo(TokenEstimator.estimate(chunk.content()));
            });
  }

  @Property
  void indexesAreContiguousFromZero(
      @ForAll("documents") String text,
      @ForAll("configurations") ChunkingProperties properties) {
    List<ChunkDraft> chunks = new DocumentChunker(properties).chunk(text, "t", "s", null);

    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).chunkIndex()).isEqualTo(i);
    }
  }

  @Property
  void chunksAreNeverBlankAndExistForNonBlankText(
      @ForAll("documents") String text,
      @ForAll("configurations") ChunkingProperties properties) {
    List<ChunkDraft> chunks = new DocumentChunker(properties).chunk(text, "t", "s", null);

    assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.content()).isNotBlank());
    assertThat(chunks.isEmpty()).isEqualTo(text.isBlank());
  }

  @Property
  void chunkingIsDeterministic(
      @ForAll("documents") String text,
      @ForAll("configurations") ChunkingProperties properties) {
    assertThat(new DocumentChunker(properties).chunk(text, "t", "s", null))
        .isEqualTo(new DocumentChunker(properties).chunk(text, "t", "s", null));
  }
}

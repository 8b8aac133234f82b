package dev.scriptorium.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.scriptorium.BaseIntegrationTest;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CorpusServiceIT extends BaseIntegrationTest {

  private static float[] unitVector(int hot) {
    float[] vector = new float[768];
    vector[hot] = 1f;
    return vector;
  }

  private static NewChunk chunk(int index, float[] embedding) {
    return new NewChunk(
        "chunk " + index, index, 2, Map.of(MetadataKeys.CHUNK_METHOD, "fixed_size"), embedding);
  }

  @Test
  void createdDocumentIsReadableWithChunksAndEmbeddings() {
    Document document =
        corpusService.createDocument(
            "Guide",
            "guide.md",
            "chunk 0 chunk 1",
            Map.of(MetadataKeys.FILE_PATH, "/docs/guide.md"),
            List.of(chunk(0, unitVector(1)), chunk(1, null)));

    List<Chunk> chunks = corpusService.getChunksByDocument(document.getId());

    assertThat(chunks).extracting(Chunk::getChunkIndex).containsExactly(0, 1);
    assertThat(chunks.get(0).getMetadata()).containsEntry(MetadataKeys.CHUNK_METHOD, "fixed_size");
    assertThat(corpusService.getChunkEmbedding(chunks.get(0).getId()))
        .hasValueSatisfying(vector -> assertThat(vector).isEqualTo(unitVector(1)));
    assertThat(corpusService.getChunkEmbedding(chunks.get(1).getId())).isEmpty();
    assertThat(corpusService.countEmbeddedChunks()).isEqualTo(1);
    assertThat(corpusService.getDocument(document.getId()))
        .hasValueSatisfying(
            stored ->
                assertThat(stored.getMetadata())
                    .containsEntry(MetadataKeys.FILE_PATH, "/docs/guide.md"));
  }

  @Test
  void deletingADocumentRemovesItsChunks() {
    Document document =
        corpusService.createDocument(
            "Guide", "guide.md", "text", Map.of(), List.of(chunk(0, unitVector(2))));

    assertThat(corpusService.deleteDocument(document.getId())).isTrue();

    assertThat(corpusService.getChunksByDocument(document.getId())).isEmpty();
    assertThat(corpusService.countChunks()).isZero();
    assertThat(corpusService.deleteDocument(document.getId())).isFalse();
  }

  @Test
  void wrongDimensionLeavesNothingBehind() {
    float[] shortVector = Arrays.copyOf(unitVector(0), 384);

    assertThatThrownBy(
            () ->
                corpusService.createDocument(
                    "Broken",
                    "broken.md",
                    "text",
                    Map.of(),
                    List.of(chunk(0, unitVector(0)), chunk(1, shortVector))))
        .isInstanceOf(EmbeddingIntegrityException.class);

    assertThat(corpusService.countDocuments()).isZero();
    assertThat(corpusService.countChunks()).isZero();
  }

  @Test
  void longTitleAndSourceAreStoredInFull() {
    String title = "T".repeat(300);
    String source = "nested/".repeat(40) + "guide.md";

    Document document =
        corpusService.createDocument(title, source, "text", Map.of(), List.of(chunk(0, null)));

    assertThat(corpusService.getDocument(document.getId()))
        .hasValueSatisfying(
            stored -> {
              assertThat(stored.getTitle()).hasSize(300);
              assertThat(stored.getSource()).isEqualTo(source);
            });
  }

  @Test
  void enrichedMetadataIsPersisted() {
    Document document =
        corpusService.createDocument(
            "Guide", "guide.md", "text", Map.of(), List.of(chunk(0, null)));

    corpusService.enrichMetadata(document.getId(), Map.of("reviewed", true));

    assertThat(corpusService.getDocument(document.getId()))
        .hasValueSatisfying(
            stored -> assertThat(stored.getMetadata()).containsEntry("reviewed", true));
  }

  @Test
  void listsDocumentsNewestFirst() throws Exception {
    corpusService.createDocument("First", "1.md", "text", Map.of(), List.of(chunk(0, null)));
    Thread.sleep(5);
    corpusService.createDocument("Second", "2.md", "text", Map.of(), List.of(chunk(0, null)));

    assertThat(corpusService.listDocuments(10, 0))
        .extracting(Document::getTitle)
        .containsExactly("Second", "First");
    assertThat(corpusService.listDocuments(1, 1))
        .extracting(Document::getTitle)
        .containsExactly("First");
  }
}

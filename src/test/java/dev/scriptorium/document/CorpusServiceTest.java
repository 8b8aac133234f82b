package dev.scriptorium.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CorpusServiceTest {

  @Mock DocumentRepository documentRepository;
  @Mock ChunkRepository chunkRepository;

  private CorpusService service;

  @BeforeEach
  void setUp() {
    service = new CorpusService(documentRepository, chunkRepository, 3);
  }

  private static <T> T withId(T entity, UUID id) {
    ReflectionTestUtils.setField(entity, "id", id);
    return entity;
  }

  private static NewChunk chunk(int index, float[] embedding) {
    return new NewChunk("chunk " + index, index, 2, Map.of(), embedding);
  }

  @Test
  void createDocumentWritesChunksAndEmbeddings() {
    UUID documentId = UUID.randomUUID();
    UUID firstChunk = UUID.randomUUID();
    UUID secondChunk = UUID.randomUUID();
    given(documentRepository.save(any(Document.class)))
        .willAnswer(invocation -> withId(invocation.getArgument(0), documentId));
    given(chunkRepository.saveAllAndFlush(anyList()))
        .willAnswer(
            invocation -> {
              List<Chunk> chunks = invocation.getArgument(0);
              return List.of(
                  withId(chunks.get(0), firstChunk), withId(chunks.get(1), secondChunk));
            });

    Document document =
        service.createDocument(
            "Title",
            "a.md",
            "full text",
            Map.of(),
            List.of(chunk(0, new float[] {1f, 0f, 0f}), chunk(1, null)));

    assertThat(document.getId()).isEqualTo(documentId);
    verify(chunkRepository).updateEmbedding(firstChunk, "[1.0,0.0,0.0]");
    verify(chunkRepository, never()).updateEmbedding(eq(secondChunk), anyString());
  }

  @Test
  void wrongDimensionAbortsBeforeAnyWrite() {
    List<NewChunk> chunks = List.of(chunk(0, new float[] {1f, 0f}));

    assertThatThrownBy(() -> service.createDocument("T", "s", "text", Map.of(), chunks))
        .isInstanceOf(EmbeddingIntegrityException.class);
    verifyNoInteractions(documentRepository, chunkRepository);
  }

  @Test
  void nonContiguousIndexesAreRejected() {
    List<NewChunk> chunks = List.of(chunk(0, null), chunk(2, null));

    assertThatThrownBy(() -> service.createDocument("T", "s", "text", Map.of(), chunks))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("contiguous");
    verifyNoInteractions(documentRepository, chunkRepository);
  }

  @Test
  void deleteDocumentReportsWhetherAnythingWasDeleted() {
    UUID existing = UUID.randomUUID();
    UUID missing = UUID.randomUUID();
    given(documentRepository.deleteDocumentById(existing)).willReturn(1);
    given(documentRepository.deleteDocumentById(missing)).willReturn(0);

    assertThat(service.deleteDocument(existing)).isTrue();
    assertThat(service.deleteDocument(missing)).isFalse();
  }

  @Test
  void listDocumentsValidatesPaging() {
    assertThatThrownBy(() -> service.listDocuments(0, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.listDocuments(10, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void chunkEmbeddingIsParsedFromLiteral() {
    UUID chunkId = UUID.randomUUID();
    given(chunkRepository.findEmbeddingLiteral(chunkId)).willReturn(Optional.of("[0.5,0.25,1.0]"));

    assertThat(service.getChunkEmbedding(chunkId)).hasValueSatisfying(
        vector -> assertThat(vector).containsExactly(0.5f, 0.25f, 1.0f));
  }

  @Test
  void enrichMetadataMergesEntries() {
    UUID id = UUID.randomUUID();
    Document document = new Document("T", "s", "text", Map.of("a", 1));
    given(documentRepository.findById(id)).willReturn(Optional.of(document));
    given(documentRepository.save(document)).willReturn(document);

    Optional<Document> enriched = service.enrichMetadata(id, Map.of("b", 2));

    assertThat(enriched).isPresent();
    assertThat(document.getMetadata()).containsEntry("a", 1).containsEntry("b", 2);
  }
}

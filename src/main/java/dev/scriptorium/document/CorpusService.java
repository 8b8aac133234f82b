package dev.scriptorium.document;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write and read operations on the corpus (documents and their chunks).
 *
 * <p><strong>Atomicity:</strong> {@link #createDocument} writes the document row, every chunk row
 * and every embedding in one transaction. Embeddings are validated against the configured
 * dimension before the first insert, so a malformed vector aborts the write with nothing visible.
 * Callers compute embeddings before calling in; no external call happens inside the transaction.
 */
@Service
public class CorpusService {

  private static final Logger log = LoggerFactory.getLogger(CorpusService.class);

  private final DocumentRepository documentRepository;
  private final ChunkRepository chunkRepository;
  private final int embeddingDimension;

  public CorpusService(
      DocumentRepository documentRepository,
      ChunkRepository chunkRepository,
      @Value("${scriptorium.embedding.dimension:768}") int embeddingDimension) {
    this.documentRepository = documentRepository;
    this.chunkRepository = chunkRepository;
    this.embeddingDimension = embeddingDimension;
  }

  /**
   * Creates a document with all of its chunks and embeddings.
   *
   * @param title document title
   * @param source document source path or identifier
   * @param fullText the complete extracted text
   * @param metadata document metadata
   * @param chunks the chunks, with contiguous indexes starting at 0
   * @return the persisted document
   * @throws EmbeddingIntegrityException if any embedding has the wrong dimension
   * @throws IllegalArgumentException if chunk indexes are not contiguous from 0
   */
  @Transactional
  public Document createDocument(
      String title,
      String source,
      String fullText,
      Map<String, ?> metadata,
      List<NewChunk> chunks) {
    checkChunkIndexes(chunks);
    String[] literals = new String[chunks.size()];
    for (int i = 0; i < chunks.size(); i++) {
      float[] embedding = chunks.get(i).embedding();
      if (embedding != null) {
        literals[i] = PgVectors.toLiteral(embedding, embeddingDimension);
      }
    }

    Document document = documentRepository.save(new Document(title, source, fullText, metadata));

    List<Chunk> entities =
        chunks.stream()
            .map(
                c ->
                    new Chunk(
                        document.getId(),
                        c.content(),
                        c.chunkIndex(),
                        c.tokenCount(),
                        c.metadata()))
            .toList();
    List<Chunk> saved = chunkRepository.saveAllAndFlush(entities);

    int embedded = 0;
    for (int i = 0; i < saved.size(); i++) {
      if (literals[i] != null) {
        chunkRepository.updateEmbedding(saved.get(i).getId(), literals[i]);
        embedded++;
      }
    }
    log.debug(
        "Stored document {} '{}' with {} chunks ({} embedded)",
        document.getId(),
        title,
        saved.size(),
        embedded);
    return document;
  }

  public Optional<Document> getDocument(UUID id) {
    return documentRepository.findById(id);
  }

  /**
   * Lists documents newest first.
   *
   * @param limit page size, at least 1
   * @param offset rows to skip, at least 0
   */
  public List<Document> listDocuments(int limit, int offset) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    return documentRepository.findPage(limit, offset);
  }

  /** Returns the chunks of a document ordered by chunk index; empty if the document is gone. */
  public List<Chunk> getChunksByDocument(UUID documentId) {
    return chunkRepository.findByDocumentIdOrderByChunkIndexAsc(documentId);
  }

  /** Returns the stored embedding of a chunk, empty if the chunk has none. */
  public Optional<float[]> getChunkEmbedding(UUID chunkId) {
    return chunkRepository.findEmbeddingLiteral(chunkId).map(PgVectors::parse);
  }

  /**
   * Deletes a document and, by cascade, its chunks.
   *
   * @return true if a document was deleted
   */
  @Transactional
  public boolean deleteDocument(UUID documentId) {
    boolean deleted = documentRepository.deleteDocumentById(documentId) > 0;
    if (deleted) {
      log.info("Deleted document {}", documentId);
    }
    return deleted;
  }

  /**
   * Resets the corpus.
   *
   * @return number of documents deleted
   */
  @Transactional
  public int deleteAllDocuments() {
    int deleted = documentRepository.deleteAllDocuments();
    log.warn("Corpus reset: deleted {} documents", deleted);
    return deleted;
  }

  /**
   * Merges metadata entries into an existing document.
   *
   * @return the updated document, empty if no document has that id
   */
  @Transactional
  public Optional<Document> enrichMetadata(UUID documentId, Map<String, ?> entries) {
    return documentRepository
        .findById(documentId)
        .map(
            document -> {
              document.enrichMetadata(entries);
              return documentRepository.save(document);
            });
  }

  public long countDocuments() {
    return documentRepository.count();
  }

  public long countChunks() {
    return chunkRepository.countAllChunks();
  }

  public long countEmbeddedChunks() {
    return chunkRepository.countEmbeddedChunks();
  }

  public int embeddingDimension() {
    return embeddingDimension;
  }

  private static void checkChunkIndexes(List<NewChunk> chunks) {
    for (int i = 0; i < chunks.size(); i++) {
      if (chunks.get(i).chunkIndex() != i) {
        throw new IllegalArgumentException(
            "Chunk indexes must be contiguous from 0; position "
                + i
                + " has index "
                + chunks.get(i).chunkIndex());
      }
    }
  }
}

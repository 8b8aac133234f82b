package dev.scriptorium.ingestion.chunking;

import java.util.Map;
import java.util.Objects;

/**
 * A chunk produced by {@link DocumentChunker}, before embedding and persistence.
 *
 * @param content passage text
 * @param chunkIndex 0-based position within the document, contiguous in emission order
 * @param tokenCount estimated token count ({@link TokenEstimator})
 * @param metadata caller metadata plus title, source, chunk_method and, for section chunks,
 *     heading_path
 */
public record ChunkDraft(
    String content, int chunkIndex, int tokenCount, Map<String, Object> metadata) {

  public ChunkDraft {
    Objects.requireNonNull(content, "content must not be null");
    metadata = metadata == null ? Map.of() : metadata;
  }
}

package dev.scriptorium.document;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A chunk ready to be written together with its document.
 *
 * @param content passage text
 * @param chunkIndex 0-based position within the document
 * @param tokenCount estimated token count, or null if unknown
 * @param metadata chunk metadata
 * @param embedding embedding vector, or null when embedding failed for this chunk
 */
public record NewChunk(
    String content,
    int chunkIndex,
    @Nullable Integer tokenCount,
    Map<String, Object> metadata,
    float @Nullable [] embedding) {

  public NewChunk {
    Objects.requireNonNull(content, "content must not be null");
    metadata = metadata == null ? Map.of() : metadata;
  }
}

package dev.scriptorium.api;

import dev.scriptorium.document.Chunk;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Chunk entry returned by {@code GET /api/documents/{id}/chunks}. */
public record ChunkInfo(
    UUID id,
    int chunkIndex,
    String content,
    @Nullable Integer tokenCount,
    Map<String, Object> metadata) {

  static ChunkInfo from(Chunk chunk) {
    return new ChunkInfo(
        chunk.getId(),
        chunk.getChunkIndex(),
        chunk.getContent(),
        chunk.getTokenCount(),
        chunk.getMetadata());
  }
}

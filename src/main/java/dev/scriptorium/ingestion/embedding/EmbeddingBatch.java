package dev.scriptorium.ingestion.embedding;

import java.util.List;

/**
 * Output of {@link ChunkEmbedder#embedChunks}: every input chunk in its original order, plus one
 * message per chunk that could not be embedded.
 *
 * @param chunks all chunks, embedded or not
 * @param errors per-chunk failure messages
 */
public record EmbeddingBatch(List<EmbeddedChunk> chunks, List<String> errors) {

  public EmbeddingBatch {
    chunks = List.copyOf(chunks);
    errors = List.copyOf(errors);
  }

  public long embeddedCount() {
    return chunks.stream().filter(EmbeddedChunk::isEmbedded).count();
  }
}

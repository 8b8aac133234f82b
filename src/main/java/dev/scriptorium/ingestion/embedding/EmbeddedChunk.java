package dev.scriptorium.ingestion.embedding;

import dev.scriptorium.document.NewChunk;
import dev.scriptorium.ingestion.chunking.ChunkDraft;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A chunk paired with its embedding, or with no embedding when inference failed for it.
 *
 * @param draft the chunk as produced by the chunker
 * @param embedding the vector, or null if embedding this chunk failed
 */
public record EmbeddedChunk(ChunkDraft draft, float @Nullable [] embedding) {

  public EmbeddedChunk {
    Objects.requireNonNull(draft, "draft must not be null");
  }

  public boolean isEmbedded() {
    return embedding != null;
  }

  /** Converts to the shape the corpus writes. */
  public NewChunk toNewChunk() {
    return new NewChunk(
        draft.content(), draft.chunkIndex(), draft.tokenCount(), draft.metadata(), embedding);
  }
}

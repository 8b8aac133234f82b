package dev.scriptorium.ingestion.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.scriptorium.document.RetrievalUnavailableException;
import dev.scriptorium.ingestion.chunking.ChunkDraft;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns chunks and queries into vectors through the configured {@link EmbeddingModel}.
 *
 * <p>Chunks are processed in batches of {@code scriptorium.embedding.batch-size}; within a batch
 * the inference calls are issued one at a time to bound load on the inference service. A failure
 * on one chunk leaves that chunk without an embedding and is recorded, the rest of the run
 * continues. The call timeout is enforced by the model client (see {@code EmbeddingConfig}).
 */
@Service
public class ChunkEmbedder {

  private static final Logger log = LoggerFactory.getLogger(ChunkEmbedder.class);

  private final EmbeddingModel embeddingModel;
  private final EmbeddingProperties properties;

  public ChunkEmbedder(EmbeddingModel embeddingModel, EmbeddingProperties properties) {
    this.embeddingModel = embeddingModel;
    this.properties = properties;
  }

  /**
   * Embeds every chunk, isolating per-chunk failures.
   *
   * @param chunks chunks in document order
   * @return the same chunks in the same order, each with its vector or none
   */
  public EmbeddingBatch embedChunks(List<ChunkDraft> chunks) {
    if (chunks.isEmpty()) {
      return new EmbeddingBatch(List.of(), List.of());
    }
    int batchSize = properties.getBatchSize();
    int totalBatches = (chunks.size() + batchSize - 1) / batchSize;
    log.info("Generating embeddings for {} chunks in {} batches", chunks.size(), totalBatches);

    List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
    List<String> errors = new ArrayList<>();
    for (int start = 0; start < chunks.size(); start += batchSize) {
      List<ChunkDraft> batch = chunks.subList(start, Math.min(start + batchSize, chunks.size()));
      log.debug("Processing embedding batch {}/{}", start / batchSize + 1, totalBatches);
      for (ChunkDraft chunk : batch) {
        try {
          embedded.add(new EmbeddedChunk(chunk, embed(chunk.content())));
        } catch (RuntimeException e) {
          log.warn("Failed to embed chunk {}: {}", chunk.chunkIndex(), e.getMessage());
          errors.add("Chunk " + chunk.chunkIndex() + ": embedding failed: " + e.getMessage());
          embedded.add(new EmbeddedChunk(chunk, null));
        }
      }
    }
    log.info(
        "Embedded {}/{} chunks ({} failed)",
        chunks.size() - errors.size(),
        chunks.size(),
        errors.size());
    return new EmbeddingBatch(embedded, errors);
  }

  /**
   * Embeds a search query. There is no search without a query vector, so failure is fatal.
   *
   * @throws RetrievalUnavailableException if the inference call fails or times out
   */
  public float[] embedQuery(String query) {
    try {
      return embed(query);
    } catch (RuntimeException e) {
      throw new RetrievalUnavailableException(
          "Query embedding failed: " + e.getMessage(), e);
    }
  }

  private float[] embed(String text) {
    Response<Embedding> response = embeddingModel.embed(text);
    if (response == null || response.content() == null) {
      throw new IllegalStateException("Embedding model returned no vector");
    }
    return response.content().vector();
  }
}

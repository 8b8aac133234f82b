package dev.scriptorium.search;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A retrieved chunk with citation data, produced fresh for each query.
 *
 * <p>{@code similarity} means different things depending on the stage that produced the result:
 * cosine similarity from vector search, mean word similarity (or a flat score) from keyword
 * search, the fused score after {@link ReciprocalRankFusion}, or the pairwise model score after
 * reranking. Scores from different stages are not comparable.
 *
 * @param chunkId the chunk identifier
 * @param documentId the owning document
 * @param content chunk text
 * @param similarity stage-specific relevance score, higher is better
 * @param metadata chunk metadata
 * @param documentTitle title of the owning document
 * @param documentSource source path or identifier of the owning document
 */
public record SearchResult(
    UUID chunkId,
    UUID documentId,
    String content,
    double similarity,
    Map<String, Object> metadata,
    String documentTitle,
    String documentSource) {

  public SearchResult {
    Objects.requireNonNull(chunkId, "chunkId must not be null");
    Objects.requireNonNull(documentId, "documentId must not be null");
    Objects.requireNonNull(content, "content must not be null");
    metadata = metadata == null ? Map.of() : metadata;
    documentTitle = documentTitle == null ? "" : documentTitle;
    documentSource = documentSource == null ? "" : documentSource;
  }

  /** Returns a copy carrying a new score; everything else is unchanged. */
  public SearchResult withSimilarity(double newSimilarity) {
    return new SearchResult(
        chunkId, documentId, content, newSimilarity, metadata, documentTitle, documentSource);
  }
}

package dev.scriptorium.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * A bounded, independently retrievable passage of a {@link Document}.
 *
 * <p>{@code chunkIndex} is the 0-based position within the owning document; the pair {@code
 * (document_id, chunk_index)} is unique. The {@code embedding vector(n)} column is written and
 * read through native queries on {@link ChunkRepository} and is not mapped as a JPA field. A chunk
 * without an embedding is still eligible for keyword search but never for vector search.
 *
 * <p>Maps to the {@code chunks} table managed by Flyway migrations.
 */
@Entity
@Table(name = "chunks")
public class Chunk {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "document_id", nullable = false, updatable = false)
  private UUID documentId;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "chunk_index", nullable = false)
  private int chunkIndex;

  @Column(name = "token_count")
  private Integer tokenCount;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(nullable = false, columnDefinition = "JSONB")
  private Map<String, Object> metadata = new LinkedHashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Chunk() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a new chunk for the given document.
   *
   * @param documentId id of the owning document
   * @param content the passage text
   * @param chunkIndex 0-based position within the document
   * @param tokenCount estimated token count, or null if unknown
   * @param metadata chunk-level metadata, validated against {@link MetadataKeys}
   */
  public Chunk(
      UUID documentId,
      String content,
      int chunkIndex,
      @Nullable Integer tokenCount,
      Map<String, ?> metadata) {
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunkIndex must be non-negative, got: " + chunkIndex);
    }
    this.documentId = documentId;
    this.content = content;
    this.chunkIndex = chunkIndex;
    this.tokenCount = tokenCount;
    this.metadata = new LinkedHashMap<>(MetadataKeys.validate(metadata));
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getContent() {
    return content;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }

  public @Nullable Integer getTokenCount() {
    return tokenCount;
  }

  public Map<String, Object> getMetadata() {
    return Collections.unmodifiableMap(metadata);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

package dev.scriptorium.document;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Spring Data repository for {@link Chunk} entities, plus the native pgvector and pg_trgm queries
 * that back vector and keyword retrieval.
 *
 * <p>The three search queries return rows in a shared column layout: {@code [chunk_id,
 * document_id, content, score, metadata_json, document_title, document_source]}.
 */
public interface ChunkRepository extends JpaRepository<Chunk, UUID> {

  List<Chunk> findByDocumentIdOrderByChunkIndexAsc(UUID documentId);

  /**
   * Writes the embedding of a single chunk.
   *
   * @param id the chunk id
   * @param embedding pgvector literal, see {@link PgVectors#toLiteral(float[], int)}
   * @return rows updated
   */
  @Modifying
  @Query(
      value = "UPDATE chunks SET embedding = CAST(:embedding AS vector) WHERE id = :id",
      nativeQuery = true)
  int updateEmbedding(@Param("id") UUID id, @Param("embedding") String embedding);

  /** Returns the embedding of a chunk as a pgvector literal, empty if absent. */
  @Query(value = "SELECT CAST(embedding AS text) FROM chunks WHERE id = :id", nativeQuery = true)
  Optional<String> findEmbeddingLiteral(@Param("id") UUID id);

  @Query(value = "SELECT COUNT(*) FROM chunks", nativeQuery = true)
  long countAllChunks();

  @Query(value = "SELECT COUNT(*) FROM chunks WHERE embedding IS NOT NULL", nativeQuery = true)
  long countEmbeddedChunks();

  /**
   * Nearest-neighbour search by cosine distance. Chunks without an embedding are excluded from the
   * candidate set; rows below the threshold are dropped before the limit applies.
   *
   * @param embedding query vector as a pgvector literal
   * @param threshold minimum cosine similarity ({@code 1 - distance})
   * @param limit maximum rows
   * @return rows ordered by similarity descending
   */
  @Query(
      value =
          """
            SELECT c.id, c.document_id, c.content,
                   1 - (c.embedding <=> CAST(:embedding AS vector)) AS similarity,
                   CAST(c.metadata AS text), d.title, d.source
            FROM chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE c.embedding IS NOT NULL
              AND 1 - (c.embedding <=> CAST(:embedding AS vector)) >= :threshold
            ORDER BY c.embedding <=> CAST(:embedding AS vector)
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> vectorSearch(
      @Param("embedding") String embedding,
      @Param("threshold") double threshold,
      @Param("limit") int limit);

  /**
   * Fuzzy keyword search using pg_trgm {@code word_similarity}. Each keyword is scored against the
   * lower-cased chunk text; the row score is the mean across keywords.
   *
   * @param keywords lower-cased keywords (already stop-word filtered)
   * @param threshold minimum mean word similarity
   * @param limit maximum rows
   * @return rows ordered by score descending, then document and chunk position
   */
  @Query(
      value =
          """
            SELECT c.id, c.document_id, c.content, s.score,
                   CAST(c.metadata AS text), d.title, d.source
            FROM chunks c
            JOIN documents d ON c.document_id = d.id
            CROSS JOIN LATERAL (
                SELECT CAST(AVG(word_similarity(k, lower(c.content))) AS double precision) AS score
                FROM unnest(CAST(:keywords AS text[])) AS k
            ) s
            WHERE s.score >= :threshold
            ORDER BY s.score DESC, c.document_id, c.chunk_index
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> fuzzyKeywordSearch(
      @Param("keywords") String[] keywords,
      @Param("threshold") double threshold,
      @Param("limit") int limit);

  /**
   * Case-insensitive substring containment on any of the given {@code LIKE} patterns, with the
   * same flat score for every row.
   *
   * @param patterns {@code %keyword%} patterns
   * @param score the score assigned to every match
   * @param limit maximum rows
   * @return matching rows ordered by document and chunk position
   */
  @Query(
      value =
          """
            SELECT c.id, c.document_id, c.content, CAST(:score AS double precision),
                   CAST(c.metadata AS text), d.title, d.source
            FROM chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE lower(c.content) LIKE ANY (CAST(:patterns AS text[]))
            ORDER BY c.document_id, c.chunk_index
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> substringKeywordSearch(
      @Param("patterns") String[] patterns,
      @Param("score") double score,
      @Param("limit") int limit);
}

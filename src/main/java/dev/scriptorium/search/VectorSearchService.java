package dev.scriptorium.search;

import dev.scriptorium.document.ChunkRepository;
import dev.scriptorium.document.PgVectors;
import dev.scriptorium.document.RetrievalUnavailableException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Nearest-neighbour retrieval over stored chunk embeddings.
 *
 * <p>Similarity is {@code 1 - cosine distance}. Chunks with no embedding are never candidates.
 * Results under the threshold are dropped before {@code limit} applies, so every returned result
 * satisfies {@code similarity >= threshold}. Order among equal similarities is whatever the index
 * returns.
 */
@Service
public class VectorSearchService {

  private static final Logger log = LoggerFactory.getLogger(VectorSearchService.class);

  private final ChunkRepository chunkRepository;
  private final SearchRowMapper rowMapper;
  private final int embeddingDimension;

  public VectorSearchService(
      ChunkRepository chunkRepository,
      SearchRowMapper rowMapper,
      @Value("${scriptorium.embedding.dimension:768}") int embeddingDimension) {
    this.chunkRepository = chunkRepository;
    this.rowMapper = rowMapper;
    this.embeddingDimension = embeddingDimension;
  }

  /**
   * Finds the chunks closest to a query vector.
   *
   * @param queryVector the query embedding, of the configured dimension
   * @param limit maximum results, at least 1
   * @param similarityThreshold minimum cosine similarity
   * @return results ordered by similarity descending
   * @throws IllegalArgumentException if limit is below 1
   * @throws RetrievalUnavailableException if the store cannot be queried
   */
  public List<SearchResult> search(float[] queryVector, int limit, double similarityThreshold) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    String literal = PgVectors.toLiteral(queryVector, embeddingDimension);
    List<Object[]> rows;
    try {
      rows = chunkRepository.vectorSearch(literal, similarityThreshold, limit);
    } catch (DataAccessException e) {
      throw new RetrievalUnavailableException("Vector search failed: " + e.getMessage(), e);
    }
    List<SearchResult> results = rowMapper.map(rows);
    log.info(
        "Vector search: threshold={}, limit={}, results={}",
        similarityThreshold,
        limit,
        results.size());
    return results;
  }
}

package dev.scriptorium.search;

import dev.scriptorium.document.ChunkRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Fuzzy keyword matching backed by pg_trgm {@code word_similarity}, which tolerates small spelling
 * and OCR errors. Each keyword is scored against the chunk text and the row score is the mean
 * across keywords.
 *
 * <p>Failures (extension missing, query error, disabled by configuration) come back as a {@link
 * RetrievalOutcome} failure, not an exception, so {@link KeywordSearchService} can fall back.
 */
@Component
public class FuzzyKeywordMatcher {

  private static final Logger log = LoggerFactory.getLogger(FuzzyKeywordMatcher.class);

  private final ChunkRepository chunkRepository;
  private final SearchRowMapper rowMapper;
  private final SearchProperties properties;

  public FuzzyKeywordMatcher(
      ChunkRepository chunkRepository, SearchRowMapper rowMapper, SearchProperties properties) {
    this.chunkRepository = chunkRepository;
    this.rowMapper = rowMapper;
    this.properties = properties;
  }

  RetrievalOutcome<List<SearchResult>> match(
      List<String> keywords, int limit, double similarityThreshold) {
    if (!properties.isFuzzyEnabled()) {
      return RetrievalOutcome.failure(FailureReason.DISABLED, "fuzzy matching disabled");
    }
    try {
      List<Object[]> rows =
          chunkRepository.fuzzyKeywordSearch(
              keywords.toArray(String[]::new), similarityThreshold, limit);
      return RetrievalOutcome.success(rowMapper.map(rows));
    } catch (DataAccessException e) {
      log.debug("Fuzzy keyword query failed", e);
      return RetrievalOutcome.failure(
          FailureReason.UNAVAILABLE, e.getMostSpecificCause().getMessage());
    }
  }
}

package dev.scriptorium.search;

import dev.scriptorium.document.ChunkRepository;
import dev.scriptorium.document.RetrievalUnavailableException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Lexical retrieval over chunk text.
 *
 * <p>The query is reduced to keywords by {@link KeywordQueryParser}; a query of only stop words or
 * very short tokens yields an empty result without touching the store. Fuzzy matching is tried
 * first. When it fails or is disabled the service falls back to substring containment on the first
 * {@value #MAX_SUBSTRING_KEYWORDS} keywords, every hit scored with {@code
 * substring-fallback-score}; no threshold applies to that path. The strategy that ran is reported
 * on the result.
 */
@Service
public class KeywordSearchService {

  private static final Logger log = LoggerFactory.getLogger(KeywordSearchService.class);

  static final int MAX_SUBSTRING_KEYWORDS = 3;

  private final FuzzyKeywordMatcher fuzzyMatcher;
  private final ChunkRepository chunkRepository;
  private final SearchRowMapper rowMapper;
  private final SearchProperties properties;

  public KeywordSearchService(
      FuzzyKeywordMatcher fuzzyMatcher,
      ChunkRepository chunkRepository,
      SearchRowMapper rowMapper,
      SearchProperties properties) {
    this.fuzzyMatcher = fuzzyMatcher;
    this.chunkRepository = chunkRepository;
    this.rowMapper = rowMapper;
    this.properties = properties;
  }

  /**
   * Runs keyword retrieval.
   *
   * @param query raw query text
   * @param limit maximum results, at least 1
   * @param similarityThreshold minimum mean word similarity for fuzzy matches
   * @return matches and the strategy that produced them
   * @throws IllegalArgumentException if limit is below 1
   * @throws RetrievalUnavailableException if both strategies fail
   */
  public KeywordSearchResult search(String query, int limit, double similarityThreshold) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    List<String> keywords = KeywordQueryParser.parse(query);
    if (keywords.isEmpty()) {
      log.debug("No keywords left after filtering query '{}'", abbreviate(query));
      return KeywordSearchResult.empty();
    }

    RetrievalOutcome<List<SearchResult>> fuzzy =
        fuzzyMatcher.match(keywords, limit, similarityThreshold);
    if (fuzzy.isSuccess()) {
      log.info("Keyword search (fuzzy): keywords={}, results={}", keywords, fuzzy.value().size());
      return new KeywordSearchResult(fuzzy.value(), KeywordStrategy.FUZZY);
    }

    if (fuzzy.reason() != FailureReason.DISABLED) {
      log.warn(
          "Fuzzy keyword search unavailable ({}: {}), falling back to substring matching",
          fuzzy.reason(),
          fuzzy.detail());
    }
    List<SearchResult> results = substringSearch(keywords, limit);
    log.info("Keyword search (substring): keywords={}, results={}", keywords, results.size());
    return new KeywordSearchResult(results, KeywordStrategy.SUBSTRING);
  }

  /** Default-threshold variant using {@code keyword-similarity-threshold}. */
  public KeywordSearchResult search(String query, int limit) {
    return search(query, limit, properties.getKeywordSimilarityThreshold());
  }

  private List<SearchResult> substringSearch(List<String> keywords, int limit) {
    String[] patterns =
        keywords.stream()
            .limit(MAX_SUBSTRING_KEYWORDS)
            .map(keyword -> "%" + keyword + "%")
            .toArray(String[]::new);
    try {
      return rowMapper.map(
          chunkRepository.substringKeywordSearch(
              patterns, properties.getSubstringFallbackScore(), limit));
    } catch (DataAccessException e) {
      throw new RetrievalUnavailableException("Keyword search failed: " + e.getMessage(), e);
    }
  }

  static String abbreviate(String query) {
    return query.length() <= 50 ? query : query.substring(0, 50) + "...";
  }
}

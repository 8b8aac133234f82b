package dev.scriptorium.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps native search rows ({@code [chunk_id, document_id, content, score, metadata_json,
 * document_title, document_source]}) to {@link SearchResult}s.
 */
@Component
public class SearchRowMapper {

  private static final Logger log = LoggerFactory.getLogger(SearchRowMapper.class);

  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public SearchRowMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<SearchResult> map(List<Object[]> rows) {
    List<SearchResult> results = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      results.add(map(row));
    }
    return results;
  }

  SearchResult map(Object[] row) {
    return new SearchResult(
        toUuid(row[0]),
        toUuid(row[1]),
        (String) row[2],
        ((Number) row[3]).doubleValue(),
        parseMetadata((String) row[4]),
        (String) row[5],
        (String) row[6]);
  }

  private Map<String, Object> parseMetadata(@Nullable String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      Map<String, Object> parsed = objectMapper.readValue(json, METADATA_TYPE);
      return parsed == null ? Map.of() : parsed;
    } catch (JsonProcessingException e) {
      log.warn("Unreadable chunk metadata, returning empty map: {}", e.getOriginalMessage());
      return Map.of();
    }
  }

  private static UUID toUuid(Object value) {
    return value instanceof UUID uuid ? uuid : UUID.fromString(value.toString());
  }
}

package dev.scriptorium.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Metadata keys recognised on documents and chunks, with the value type each must carry.
 *
 * <p>The key set is open: unknown keys are accepted as long as their values are JSON-compatible
 * (string, number, boolean, list, map or null). Known keys are type-checked by {@link
 * #validate(Map)} before anything is written to the JSONB columns.
 */
public final class MetadataKeys {

  /** Absolute or workspace-relative path the document was read from. */
  public static final String FILE_PATH = "file_path";

  /** ISO-8601 instant at which the document was ingested. */
  public static final String INGESTION_DATE = "ingestion_date";

  /** True when the document arrived through single-file upload rather than a folder run. */
  public static final String UPLOADED = "uploaded";

  /** Client-supplied file name of an uploaded document. */
  public static final String ORIGINAL_FILENAME = "original_filename";

  /** Title of the owning document, copied onto each chunk. */
  public static final String TITLE = "title";

  /** Source identifier of the owning document, copied onto each chunk. */
  public static final String SOURCE = "source";

  /** Splitting strategy: {@code markdown_sections} or {@code fixed_size}. */
  public static final String CHUNK_METHOD = "chunk_method";

  /** Heading breadcrumb of the section a chunk was cut from, e.g. {@code "Guide > Setup"}. */
  public static final String HEADING_PATH = "heading_path";

  private static final Map<String, Class<?>> KNOWN_TYPES =
      Map.of(
          FILE_PATH, String.class,
          INGESTION_DATE, String.class,
          UPLOADED, Boolean.class,
          ORIGINAL_FILENAME, String.class,
          TITLE, String.class,
          SOURCE, String.class,
          CHUNK_METHOD, String.class,
          HEADING_PATH, String.class);

  private MetadataKeys() {}

  /**
   * Validates a metadata mapping and returns an unmodifiable, insertion-ordered copy.
   *
   * @param metadata the mapping to check; null is treated as empty
   * @return validated copy
   * @throws IllegalArgumentException if a known key carries the wrong type or a value is not
   *     JSON-compatible
   */
  public static Map<String, Object> validate(@Nullable Map<String, ?> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : metadata.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("Metadata keys must not be blank");
      }
      Class<?> expected = KNOWN_TYPES.get(key);
      if (value != null && expected != null && !expected.isInstance(value)) {
        throw new IllegalArgumentException(
            "Metadata key '"
                + key
                + "' expects "
                + expected.getSimpleName()
                + " but got "
                + value.getClass().getSimpleName());
      }
      if (!isJsonCompatible(value)) {
        throw new IllegalArgumentException(
            "Metadata key '" + key + "' has unsupported value type " + value.getClass().getName());
      }
      copy.put(key, value);
    }
    return Collections.unmodifiableMap(copy);
  }

  private static boolean isJsonCompatible(@Nullable Object value) {
    if (value == null
        || value instanceof String
        || value instanceof Number
        || value instanceof Boolean) {
      return true;
    }
    if (value instanceof List<?> list) {
      return list.stream().allMatch(MetadataKeys::isJsonCompatible);
    }
    if (value instanceof Map<?, ?> map) {
      return map.keySet().stream().allMatch(String.class::isInstance)
          && map.values().stream().allMatch(MetadataKeys::isJsonCompatible);
    }
    return false;
  }
}

package dev.scriptorium.api;

import dev.scriptorium.document.Document;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Document listing entry; the full text is left out. */
public record DocumentInfo(
    UUID id,
    String title,
    String source,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt) {

  static DocumentInfo from(Document document) {
    return new DocumentInfo(
        document.getId(),
        document.getTitle(),
        document.getSource(),
        document.getMetadata(),
        document.getCreatedAt(),
        document.getUpdatedAt());
  }
}

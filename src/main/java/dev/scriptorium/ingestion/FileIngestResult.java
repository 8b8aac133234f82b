package dev.scriptorium.ingestion;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of ingesting one file.
 *
 * @param source source identifier of the file
 * @param title resolved document title, null if the file could not be read
 * @param documentId id of the stored document, null on failure
 * @param chunksCreated chunks written, 0 on failure
 * @param chunksEmbedded chunks written with an embedding
 * @param errors failure message for the file, or per-chunk embedding messages on success
 */
public record FileIngestResult(
    String source,
    @Nullable String title,
    @Nullable UUID documentId,
    int chunksCreated,
    int chunksEmbedded,
    List<String> errors) {

  public FileIngestResult {
    errors = List.copyOf(errors);
  }

  public boolean succeeded() {
    return documentId != null;
  }

  static FileIngestResult failed(String source, @Nullable String title, String error) {
    return new FileIngestResult(source, title, null, 0, 0, List.of(error));
  }
}

package dev.scriptorium.ingestion;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a batch ingestion run.
 *
 * @param documentsProcessed files attempted
 * @param succeeded files stored
 * @param failed files that could not be stored
 * @param chunksCreated chunks written across all files
 * @param errors per-file and per-chunk messages, each prefixed with the file's source
 */
public record IngestionReport(
    int documentsProcessed, int succeeded, int failed, int chunksCreated, List<String> errors) {

  public IngestionReport {
    errors = List.copyOf(errors);
  }

  static IngestionReport of(List<FileIngestResult> results) {
    int succeeded = 0;
    int chunks = 0;
    List<String> errors = new ArrayList<>();
    for (FileIngestResult result : results) {
      if (result.succeeded()) {
        succeeded++;
        chunks += result.chunksCreated();
      }
      for (String error : result.errors()) {
        errors.add(result.source() + ": " + error);
      }
    }
    return new IngestionReport(
        results.size(), succeeded, results.size() - succeeded, chunks, errors);
  }
}

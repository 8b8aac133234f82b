package dev.scriptorium.ingestion.extraction;

import java.io.IOException;
import java.nio.file.Path;

/** Converts a file on disk into plain text for chunking. */
public interface TextExtractor {

  /** Returns true if this extractor handles the file, judged by its extension. */
  boolean supports(Path file);

  /**
   * Reads the file and returns its text.
   *
   * @throws IOException if the file cannot be read
   */
  ExtractedText extract(Path file) throws IOException;
}

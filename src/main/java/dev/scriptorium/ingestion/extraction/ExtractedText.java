package dev.scriptorium.ingestion.extraction;

import dev.scriptorium.ingestion.chunking.DocumentFormat;
import java.util.Objects;

/**
 * Plain text produced by a {@link TextExtractor}, with a hint on whether it carries Markdown
 * structure the chunker can use.
 *
 * @param text the extracted text, possibly empty
 * @param format MARKDOWN when heading structure may be present, PLAIN otherwise
 */
public record ExtractedText(String text, DocumentFormat format) {

  public ExtractedText {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(format, "format must not be null");
  }
}

package dev.scriptorium.ingestion.chunking;

/**
 * Structural hint produced by text extraction. MARKDOWN text may carry a heading hierarchy the
 * chunker can split on; PLAIN text never does.
 */
public enum DocumentFormat {
  MARKDOWN,
  PLAIN
}

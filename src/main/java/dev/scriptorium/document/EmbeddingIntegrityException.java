package dev.scriptorium.document;

/**
 * Raised when an embedding cannot be stored without corrupting the index: its dimensionality
 * differs from the configured system-wide dimension, or it contains non-finite components.
 *
 * <p>Fatal for the write that carries it. The surrounding document transaction rolls back.
 */
public class EmbeddingIntegrityException extends RuntimeException {

  public EmbeddingIntegrityException(String message) {
    super(message);
  }

  static EmbeddingIntegrityException dimensionMismatch(int expected, int actual) {
    return new EmbeddingIntegrityException(
        "Embedding dimension mismatch: expected " + expected + " but got " + actual);
  }
}

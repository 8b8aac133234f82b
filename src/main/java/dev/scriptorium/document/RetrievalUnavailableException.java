package dev.scriptorium.document;

/**
 * An external dependency of retrieval (embedding inference, scoring inference or the store) could
 * not be reached, failed, or did not answer within its timeout.
 *
 * <p>Kept distinct from validation errors ({@link IllegalArgumentException}) so callers can decide
 * whether to retry.
 */
public class RetrievalUnavailableException extends RuntimeException {

  public RetrievalUnavailableException(String message) {
    super(message);
  }

  public RetrievalUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

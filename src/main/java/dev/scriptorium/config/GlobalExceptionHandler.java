package dev.scriptorium.config;

import dev.scriptorium.document.EmbeddingIntegrityException;
import dev.scriptorium.document.RetrievalUnavailableException;
import dev.scriptorium.ingestion.IngestionInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} (validation) - 400
 *   <li>{@link IngestionInProgressException} - 409
 *   <li>{@link EmbeddingIntegrityException} (data integrity) - 500
 *   <li>{@link RetrievalUnavailableException} (connectivity) - 503
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(IngestionInProgressException.class)
  ProblemDetail handleIngestionInProgress(IngestionInProgressException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(EmbeddingIntegrityException.class)
  ProblemDetail handleEmbeddingIntegrity(EmbeddingIntegrityException ex) {
    log.error("Rejected write with malformed embedding: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
  }

  /** Connectivity failures; clients may retry. */
  @ExceptionHandler(RetrievalUnavailableException.class)
  ProblemDetail handleRetrievalUnavailable(RetrievalUnavailableException ex) {
    log.warn("Retrieval unavailable: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }
}

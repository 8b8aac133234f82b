package dev.scriptorium.ingestion;

/** Thrown when a batch ingestion is requested while another one is still running. */
public class IngestionInProgressException extends RuntimeException {

  public IngestionInProgressException() {
    super("An ingestion run is already in progress");
  }
}

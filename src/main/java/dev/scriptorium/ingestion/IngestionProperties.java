package dev.scriptorium.ingestion;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Batch ingestion settings, bound from {@code scriptorium.ingestion.*}.
 *
 * <ul>
 *   <li>{@code documents-folder} - folder scanned when a run names none (default documents)
 *   <li>{@code clean-before-ingest} - reset the corpus before a run when the caller does not say
 *       (default false)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.ingestion")
public class IngestionProperties {

  private String documentsFolder = "documents";
  private boolean cleanBeforeIngest = false;

  @PostConstruct
  void validate() {
    if (documentsFolder == null || documentsFolder.isBlank()) {
      throw new IllegalStateException("scriptorium.ingestion.documents-folder must not be blank");
    }
  }

  public String getDocumentsFolder() {
    return documentsFolder;
  }

  public void setDocumentsFolder(String documentsFolder) {
    this.documentsFolder = documentsFolder;
  }

  public boolean isCleanBeforeIngest() {
    return cleanBeforeIngest;
  }

  public void setCleanBeforeIngest(boolean cleanBeforeIngest) {
    this.cleanBeforeIngest = cleanBeforeIngest;
  }
}

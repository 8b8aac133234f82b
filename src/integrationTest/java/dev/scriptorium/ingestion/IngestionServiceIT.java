package dev.scriptorium.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import dev.scriptorium.BaseIntegrationTest;
import dev.scriptorium.document.Chunk;
import dev.scriptorium.document.Document;
import dev.scriptorium.document.MetadataKeys;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;

class IngestionServiceIT extends BaseIntegrationTest {

  @Autowired IngestionService ingestionService;

  @TempDir Path documents;

  @Test
  void ingestsFolderIntoSearchableChunks() throws Exception {
    Files.writeString(
        documents.resolve("guide.md"),
        """
        # Guide

        The guide introduces the system, explains the vocabulary it uses and walks through
        the main concepts a new reader needs before going further.

        ## Setup

        Install the package, then point the configuration at your database and check that
        the connection works by running the health command once.
        """);
    Files.writeString(documents.resolve("notes.txt"), "Plain notes about release planning.");
    Files.writeString(documents.resolve("empty.md"), "   ");

    IngestionReport report = ingestionService.ingestFolder(documents, false);

    assertThat(report.documentsProcessed()).isEqualTo(3);
    assertThat(report.succeeded()).isEqualTo(2);
    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.errors()).containsExactly("empty.md: " + IngestionService.NO_CHUNKS);

    Document guide =
        corpusService.listDocuments(10, 0).stream()
            .filter(d -> d.getSource().equals("guide.md"))
            .findFirst()
            .orElseThrow();
    assertThat(guide.getTitle()).isEqualTo("Guide");
    assertThat(guide.getMetadata()).containsKey(MetadataKeys.INGESTION_DATE);

    List<Chunk> chunks = corpusService.getChunksByDocument(guide.getId());
    assertThat(chunks)
        .extracting(c -> c.getMetadata().get(MetadataKeys.HEADING_PATH))
        .containsExactly("Guide", "Guide > Setup");
    assertThat(corpusService.countEmbeddedChunks()).isEqualTo(corpusService.countChunks());
  }

  @Test
  void cleanRunReplacesTheCorpus() throws Exception {
    Files.writeString(documents.resolve("a.md"), "First version of the document.");
    ingestionService.ingestFolder(documents, false);
    ingestionService.ingestFolder(documents, false);
    assertThat(corpusService.countDocuments()).isEqualTo(2);

    IngestionReport report = ingestionService.ingestFolder(documents, true);

    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(corpusService.countDocuments()).isEqualTo(1);
  }
}

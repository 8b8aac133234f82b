package dev.scriptorium.ingestion;

import dev.scriptorium.document.CorpusService;
import dev.scriptorium.document.Document;
import dev.scriptorium.document.MetadataKeys;
import dev.scriptorium.document.NewChunk;
import dev.scriptorium.ingestion.chunking.ChunkDraft;
import dev.scriptorium.ingestion.chunking.DocumentChunker;
import dev.scriptorium.ingestion.embedding.ChunkEmbedder;
import dev.scriptorium.ingestion.embedding.EmbeddedChunk;
import dev.scriptorium.ingestion.embedding.EmbeddingBatch;
import dev.scriptorium.ingestion.extraction.ExtractedText;
import dev.scriptorium.ingestion.extraction.TextExtractor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the ingestion pipeline: file -> extract -> title -> chunk -> embed -> store.
 *
 * <p><strong>Transaction semantics:</strong> each file is processed in isolation. Embeddings are
 * computed first, outside any transaction; the document, its chunks and their embeddings are then
 * written atomically by {@link CorpusService#createDocument}. A failing file is recorded in the
 * run's report and never leaves a partial document behind; files stored before it stay stored.
 *
 * <p>At most one batch run is active at a time. A second concurrent {@link #ingestFolder} call is
 * rejected with {@link IngestionInProgressException} instead of queuing.
 */
@Service
public class IngestionService {

  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  /** Lines searched for a level-1 Markdown heading when resolving a title. */
  static final int TITLE_SCAN_LINES = 10;

  static final String NO_CHUNKS = "No chunks created";

  private final List<TextExtractor> extractors;
  private final DocumentChunker chunker;
  private final ChunkEmbedder embedder;
  private final CorpusService corpusService;
  private final IngestionProperties properties;
  private final Clock clock;
  private final ReentrantLock runLock = new ReentrantLock();

  public IngestionService(
      List<TextExtractor> extractors,
      DocumentChunker chunker,
      ChunkEmbedder embedder,
      CorpusService corpusService,
      IngestionProperties properties,
      Clock clock) {
    this.extractors = List.copyOf(extractors);
    this.chunker = chunker;
    this.embedder = embedder;
    this.corpusService = corpusService;
    this.properties = properties;
    this.clock = clock;
  }

  /** Ingests the configured documents folder with the configured clean setting. */
  public IngestionReport ingestFolder() {
    return ingestFolder(null, null);
  }

  /**
   * Ingests every supported file under a folder, recursively, in sorted path order.
   *
   * @param documentsPath folder to scan, null for {@code scriptorium.ingestion.documents-folder}
   * @param cleanExisting reset the corpus first, null for {@code clean-before-ingest}
   * @return run summary with per-file errors
   * @throws IllegalArgumentException if the folder does not exist
   * @throws IngestionInProgressException if another run is active
   */
  public IngestionReport ingestFolder(
      @Nullable Path documentsPath, @Nullable Boolean cleanExisting) {
    Path folder =
        documentsPath != null ? documentsPath : Path.of(properties.getDocumentsFolder());
    boolean clean = cleanExisting != null ? cleanExisting : properties.isCleanBeforeIngest();
    if (!Files.isDirectory(folder)) {
      throw new IllegalArgumentException("Documents folder not found: " + folder);
    }
    if (!runLock.tryLock()) {
      throw new IngestionInProgressException();
    }
    try {
      log.info("Starting ingestion of {} (clean={})", folder, clean);
      if (clean) {
        int deleted = corpusService.deleteAllDocuments();
        log.info("Deleted {} existing documents", deleted);
      }

      List<Path> files = findDocumentFiles(folder);
      log.info("Found {} documents to process", files.size());

      List<FileIngestResult> results = new ArrayList<>(files.size());
      for (int i = 0; i < files.size(); i++) {
        Path file = files.get(i);
        String source = folder.relativize(file).toString();
        log.info("Processing file {}/{}: {}", i + 1, files.size(), source);
        results.add(ingestFileIsolated(file, source));
      }

      IngestionReport report = IngestionReport.of(results);
      log.info(
          "Ingestion complete: {} processed, {} succeeded, {} failed, {} chunks; corpus now {}"
              + " documents / {} chunks",
          report.documentsProcessed(),
          report.succeeded(),
          report.failed(),
          report.chunksCreated(),
          corpusService.countDocuments(),
          corpusService.countChunks());
      return report;
    } finally {
      runLock.unlock();
    }
  }

  /**
   * Ingests a single uploaded file.
   *
   * @param filename client-supplied file name; its extension selects the extractor
   * @param content raw file bytes
   * @return result carrying the new document id
   * @throws IllegalArgumentException if the file type is unsupported or yields no chunks
   */
  public FileIngestResult ingestUpload(String filename, byte[] content) {
    String originalName = baseName(filename);
    Path probe = Path.of(originalName);
    TextExtractor extractor =
        findExtractor(probe)
            .orElseThrow(
                () -> new IllegalArgumentException("Unsupported file type: " + originalName));

    Path tempFile = null;
    try {
      tempFile = Files.createTempFile("scriptorium-upload-", "-" + originalName);
      Files.write(tempFile, content);
      log.info("Processing uploaded file: {}", originalName);

      ExtractedText extracted = extractor.extract(tempFile);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put(MetadataKeys.UPLOADED, Boolean.TRUE);
      metadata.put(MetadataKeys.ORIGINAL_FILENAME, originalName);

      FileIngestResult result = store(extracted, originalName, originalName, metadata);
      if (!result.succeeded()) {
        throw new IllegalArgumentException("No chunks could be created from " + originalName);
      }
      return result;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to process upload " + originalName, e);
    } finally {
      deleteQuietly(tempFile);
    }
  }

  private FileIngestResult ingestFileIsolated(Path file, String source) {
    String title = null;
    try {
      TextExtractor extractor =
          findExtractor(file)
              .orElseThrow(() -> new IllegalArgumentException("Unsupported file type"));
      ExtractedText extracted = extractor.extract(file);
      title = extractTitle(extracted.text(), file.getFileName().toString());

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put(MetadataKeys.FILE_PATH, file.toString());
      return store(extracted, file.getFileName().toString(), source, metadata);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to ingest {}: {}", source, e.getMessage(), e);
      return FileIngestResult.failed(source, title, e.getMessage());
    }
  }

  /**
   * Chunks, embeds and stores one document. Returns a failed result when the text yields no
   * chunks; lets store errors propagate.
   */
  private FileIngestResult store(
      ExtractedText extracted,
      String fileName,
      String source,
      Map<String, Object> baseMetadata) {
    String title = extractTitle(extracted.text(), fileName);
    List<ChunkDraft> drafts =
        chunker.chunk(extracted.text(), extracted.format(), title, source, baseMetadata);
    if (drafts.isEmpty()) {
      log.warn("No chunks created for {}", source);
      return FileIngestResult.failed(source, title, NO_CHUNKS);
    }

    EmbeddingBatch batch = embedder.embedChunks(drafts);
    List<NewChunk> chunks = batch.chunks().stream().map(EmbeddedChunk::toNewChunk).toList();

    Map<String, Object> documentMetadata = new LinkedHashMap<>(baseMetadata);
    documentMetadata.put(MetadataKeys.INGESTION_DATE, Instant.now(clock).toString());

    Document document =
        corpusService.createDocument(title, source, extracted.text(), documentMetadata, chunks);
    log.info(
        "Stored '{}' as {} with {} chunks ({} embedded)",
        title,
        document.getId(),
        chunks.size(),
        batch.embeddedCount());
    return new FileIngestResult(
        source,
        title,
        document.getId(),
        chunks.size(),
        (int) batch.embeddedCount(),
        batch.errors());
  }

  /**
   * Resolves a document title: the first {@code "# "} heading within the first {@value
   * #TITLE_SCAN_LINES} lines, otherwise the file name without its extension.
   */
  static String extractTitle(String content, String fileName) {
    String[] lines = content.split("\n", TITLE_SCAN_LINES + 1);
    for (int i = 0; i < Math.min(lines.length, TITLE_SCAN_LINES); i++) {
      String line = lines[i].strip();
      if (line.startsWith("# ")) {
        String heading = line.substring(2).strip();
        if (!heading.isEmpty()) {
          return heading;
        }
      }
    }
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  List<Path> findDocumentFiles(Path folder) {
    try (Stream<Path> paths = Files.walk(folder)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(path -> findExtractor(path).isPresent())
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + folder, e);
    }
  }

  private Optional<TextExtractor> findExtractor(Path file) {
    return extractors.stream().filter(extractor -> extractor.supports(file)).findFirst();
  }

  private static String baseName(String filename) {
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("File name must not be blank");
    }
    Path name = Path.of(filename.replace('\\', '/')).getFileName();
    if (name == null || name.toString().isBlank()) {
      throw new IllegalArgumentException("File name must not be blank");
    }
    return name.toString();
  }

  private static void deleteQuietly(@Nullable Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", file, e.getMessage());
    }
  }
}

package dev.scriptorium.api;

import dev.scriptorium.document.CorpusService;
import dev.scriptorium.ingestion.FileIngestResult;
import dev.scriptorium.ingestion.IngestionReport;
import dev.scriptorium.ingestion.IngestionService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Corpus management and ingestion endpoints.
 *
 * <pre>
 *   GET    /api/documents?limit=&amp;offset=   list documents, newest first
 *   GET    /api/documents/{id}/chunks       chunks of one document in order
 *   DELETE /api/documents/{id}              delete one document and its chunks
 *   DELETE /api/documents                   reset the corpus
 *   POST   /api/ingest                      ingest a folder
 *   POST   /api/upload                      ingest one uploaded file (multipart "file")
 *   GET    /api/stats                       corpus counts
 * </pre>
 */
@RestController
@RequestMapping("/api")
public class DocumentController {

  private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

  private final CorpusService corpusService;
  private final IngestionService ingestionService;

  public DocumentController(CorpusService corpusService, IngestionService ingestionService) {
    this.corpusService = corpusService;
    this.ingestionService = ingestionService;
  }

  @GetMapping("/documents")
  public List<DocumentInfo> listDocuments(
      @RequestParam(value = "limit", defaultValue = "100") int limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset) {
    return corpusService.listDocuments(limit, offset).stream().map(DocumentInfo::from).toList();
  }

  @GetMapping("/documents/{id}/chunks")
  public ResponseEntity<List<ChunkInfo>> getChunks(@PathVariable("id") UUID id) {
    if (corpusService.getDocument(id).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(
        corpusService.getChunksByDocument(id).stream().map(ChunkInfo::from).toList());
  }

  @DeleteMapping("/documents/{id}")
  public ResponseEntity<Void> deleteDocument(@PathVariable("id") UUID id) {
    return corpusService.deleteDocument(id)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @DeleteMapping("/documents")
  public Map<String, Integer> deleteAllDocuments() {
    return Map.of("deleted", corpusService.deleteAllDocuments());
  }

  @PostMapping("/ingest")
  public IngestionReport ingest(@RequestBody(required = false) IngestApiRequest request) {
    Path folder =
        request != null && request.documentsPath() != null
            ? Path.of(request.documentsPath())
            : null;
    Boolean clean = request != null ? request.cleanExisting() : null;
    return ingestionService.ingestFolder(folder, clean);
  }

  @PostMapping("/upload")
  public FileIngestResult upload(@RequestParam("file") MultipartFile file) {
    if (file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    String filename = file.getOriginalFilename();
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("Uploaded file has no name");
    }
    try {
      FileIngestResult result = ingestionService.ingestUpload(filename, file.getBytes());
      log.info("Uploaded {}: {} chunks", filename, result.chunksCreated());
      return result;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read upload " + filename, e);
    }
  }

  @GetMapping("/stats")
  public StatsResponse stats() {
    return new StatsResponse(
        corpusService.countDocuments(),
        corpusService.countChunks(),
        corpusService.countEmbeddedChunks(),
        corpusService.embeddingDimension());
  }
}

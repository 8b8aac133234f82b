package dev.scriptorium.ingestion.extraction;

import dev.scriptorium.ingestion.chunking.DocumentFormat;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads Markdown and plain-text files as UTF-8, falling back to ISO-8859-1 when the bytes are not
 * valid UTF-8.
 */
@Component
public class PlainTextExtractor implements TextExtractor {

  private static final Logger log = LoggerFactory.getLogger(PlainTextExtractor.class);

  private static final Map<String, DocumentFormat> FORMATS =
      Map.of(
          "md", DocumentFormat.MARKDOWN,
          "markdown", DocumentFormat.MARKDOWN,
          "txt", DocumentFormat.PLAIN);

  @Override
  public boolean supports(Path file) {
    return formatOf(file).isPresent();
  }

  @Override
  public ExtractedText extract(Path file) throws IOException {
    DocumentFormat format =
        formatOf(file)
            .orElseThrow(() -> new IllegalArgumentException("Unsupported file type: " + file));
    return new ExtractedText(decode(Files.readAllBytes(file), file), format);
  }

  /** Maps a file name to its format by extension, case-insensitively. */
  public static Optional<DocumentFormat> formatOf(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return Optional.empty();
    }
    String fileName = name.toString();
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return Optional.empty();
    }
    return Optional.ofNullable(FORMATS.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT)));
  }

  static String decode(byte[] bytes, Path file) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      log.debug("{} is not valid UTF-8, reading as ISO-8859-1", file);
      return new String(bytes, StandardCharsets.ISO_8859_1);
    }
  }
}

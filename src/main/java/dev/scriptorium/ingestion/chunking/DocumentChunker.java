package dev.scriptorium.ingestion.chunking;

import dev.scriptorium.document.MetadataKeys;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Splits document text into bounded passages.
 *
 * <p>When the text carries a Markdown heading hierarchy (H1/H2/H3, ATX or setext) and semantic
 * splitting is enabled, each heading opens a new section and the section's raw source lines form
 * one passage; H4+ headings stay inside their enclosing section. Otherwise, or for {@link
 * DocumentFormat#PLAIN} input, the text is cut by {@link FixedSizeSplitter} with the configured
 * window and overlap.
 *
 * <p>Guarantees, for any input and configuration:
 *
 * <ul>
 *   <li>every chunk's {@link TokenEstimator} estimate is at most {@code max-tokens} (oversized
 *       sections are re-split with the fixed-size splitter)
 *   <li>chunks shorter than {@code min-chunk-chars} are merged into a neighbour when the merge
 *       stays within the token bound; a lone short document still yields one chunk
 *   <li>blank input yields no chunks
 *   <li>identical input and configuration yield identical chunks
 * </ul>
 */
@Component
public class DocumentChunker {

  static final String METHOD_SECTIONS = "markdown_sections";
  static final String METHOD_FIXED = "fixed_size";

  private static final String HEADING_SEPARATOR = " > ";

  private final ChunkingProperties properties;
  private final Parser parser;
  private final TextContentRenderer textRenderer;

  public DocumentChunker(ChunkingProperties properties) {
    this.properties = properties;
    var extensions = List.of(TablesExtension.create());
    this.parser =
        Parser.builder()
            .extensions(extensions)
            .includeSourceSpans(IncludeSourceSpans.BLOCKS)
            .build();
    this.textRenderer = TextContentRenderer.builder().extensions(extensions).build();
  }

  /**
   * Chunks text whose structure is unknown; Markdown headings are used when present.
   *
   * @param text document text
   * @param title document title, copied into chunk metadata
   * @param source document source, copied into chunk metadata
   * @param metadata caller metadata copied onto every chunk
   * @return ordered chunks with contiguous indexes from 0
   */
  public List<ChunkDraft> chunk(
      @Nullable String text, String title, String source, @Nullable Map<String, ?> metadata) {
    return chunk(text, DocumentFormat.MARKDOWN, title, source, metadata);
  }

  /**
   * Chunks text using the structural hint from extraction.
   *
   * @param text document text
   * @param format MARKDOWN allows heading-based splitting, PLAIN forces fixed-size splitting
   * @param title document title, copied into chunk metadata
   * @param source document source, copied into chunk metadata
   * @param metadata caller metadata copied onto every chunk
   * @return ordered chunks with contiguous indexes from 0
   */
  public List<ChunkDraft> chunk(
      @Nullable String text,
      DocumentFormat format,
      String title,
      String source,
      @Nullable Map<String, ?> metadata) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    int maxChars = TokenEstimator.maxCharsFor(properties.getMaxTokens());
    int window = Math.min(properties.getChunkSize(), maxChars);
    int overlap = Math.min(properties.getChunkOverlap(), window / 2);

    List<Section> sections =
        properties.isSemanticSplitting() && format == DocumentFormat.MARKDOWN
            ? splitSections(text)
            : List.of();

    String method;
    List<Piece> pieces = new ArrayList<>();
    if (!sections.isEmpty()) {
      method = METHOD_SECTIONS;
      for (Section section : sections) {
        if (section.text().length() <= maxChars) {
          pieces.add(new Piece(section.text(), section.headingPath()));
        } else {
          for (String part : FixedSizeSplitter.split(section.text(), window, overlap)) {
            pieces.add(new Piece(part, section.headingPath()));
          }
        }
      }
    } else {
      method = METHOD_FIXED;
      for (String part : FixedSizeSplitter.split(text, window, overlap)) {
        pieces.add(new Piece(part, null));
      }
    }

    List<Piece> merged = mergeSmallPieces(pieces, properties.getMinChunkChars(), maxChars);

    Map<String, Object> base = new LinkedHashMap<>(MetadataKeys.validate(metadata));
    base.put(MetadataKeys.TITLE, title);
    base.put(MetadataKeys.SOURCE, source);
    base.put(MetadataKeys.CHUNK_METHOD, method);

    List<ChunkDraft> drafts = new ArrayList<>(merged.size());
    for (int i = 0; i < merged.size(); i++) {
      Piece piece = merged.get(i);
      Map<String, Object> chunkMetadata = new LinkedHashMap<>(base);
      if (piece.headingPath() != null) {
        chunkMetadata.put(MetadataKeys.HEADING_PATH, piece.headingPath());
      }
      drafts.add(
          new ChunkDraft(
              piece.text(),
              i,
              TokenEstimator.estimate(piece.text()),
              Collections.unmodifiableMap(chunkMetadata)));
    }
    return drafts;
  }

  /**
   * Cuts Markdown into sections at H1/H2/H3 boundaries using source line positions. Returns an
   * empty list when the text has no such heading, which callers treat as "no structure".
   */
  List<Section> splitSections(String markdown) {
    Node document = parser.parse(markdown);
    String[] lines = markdown.split("\n", -1);

    List<Integer> startLines = new ArrayList<>();
    List<Heading> headings = new ArrayList<>();
    for (Node child = document.getFirstChild(); child != null; child = child.getNext()) {
      if (child instanceof Heading heading && heading.getLevel() <= 3) {
        int line = firstSourceLine(heading);
        if (line < 0) {
          return List.of();
        }
        startLines.add(line);
        headings.add(heading);
      }
    }
    if (headings.isEmpty()) {
      return List.of();
    }

    List<Section> sections = new ArrayList<>();
    String preamble = joinLines(lines, 0, startLines.get(0));
    if (!preamble.isBlank()) {
      sections.add(new Section(preamble.strip(), null));
    }

    @Nullable String[] headingPath = new @Nullable String[3];
    for (int i = 0; i < headings.size(); i++) {
      Heading heading = headings.get(i);
      int level = heading.getLevel();
      headingPath[level - 1] = textRenderer.render(heading).strip();
      for (int j = level; j < 3; j++) {
        headingPath[j] = null;
      }
      int end = i + 1 < startLines.size() ? startLines.get(i + 1) : lines.length;
      String body = joinLines(lines, startLines.get(i), end).strip();
      if (!body.isEmpty()) {
        sections.add(new Section(body, buildHeadingPath(headingPath)));
      }
    }
    return sections;
  }

  /**
   * Folds pieces shorter than {@code minChars} into a neighbour: first the following piece, else
   * the preceding one. A merge that would exceed {@code maxChars} is not performed.
   */
  static List<Piece> mergeSmallPieces(List<Piece> pieces, int minChars, int maxChars) {
    List<Piece> result = new ArrayList<>();
    Piece pending = null;
    for (Piece piece : pieces) {
      Piece current = piece;
      if (pending != null) {
        if (fits(pending, piece, maxChars)) {
          current = join(pending, piece);
        } else {
          appendOrMergeIntoLast(result, pending, maxChars);
        }
        pending = null;
      }
      if (current.text().length() < minChars) {
        pending = current;
      } else {
        result.add(current);
      }
    }
    if (pending != null) {
      appendOrMergeIntoLast(result, pending, maxChars);
    }
    return result;
  }

  private static void appendOrMergeIntoLast(List<Piece> result, Piece small, int maxChars) {
    int last = result.size() - 1;
    if (last >= 0 && fits(result.get(last), small, maxChars)) {
      result.set(last, join(result.get(last), small));
    } else {
      result.add(small);
    }
  }

  private static boolean fits(Piece first, Piece second, int maxChars) {
    return first.text().length() + 2 + second.text().length() <= maxChars;
  }

  private static Piece join(Piece first, Piece second) {
    String headingPath = first.headingPath() != null ? first.headingPath() : second.headingPath();
    return new Piece(first.text() + "\n\n" + second.text(), headingPath);
  }

  private static int firstSourceLine(Node node) {
    List<SourceSpan> spans = node.getSourceSpans();
    if (spans == null || spans.isEmpty() || spans.get(0) == null) {
      return -1;
    }
    return spans.get(0).getLineIndex();
  }

  private static String joinLines(String[] lines, int fromInclusive, int toExclusive) {
    return String.join("\n", Arrays.asList(lines).subList(fromInclusive, toExclusive));
  }

  private static @Nullable String buildHeadingPath(@Nullable String[] headingPath) {
    String path =
        Arrays.stream(headingPath)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(HEADING_SEPARATOR));
    return path.isEmpty() ? null : path;
  }

  /** A heading-delimited slice of a Markdown document. */
  record Section(String text, @Nullable String headingPath) {}

  /** An intermediate passage before indexes and metadata are assigned. */
  record Piece(String text, @Nullable String headingPath) {}
}

package dev.scriptorium.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window splitter with overlap.
 *
 * <p>Each window is at most {@code windowChars} long. Within the second half of a window the cut
 * is moved back to the last paragraph break, else the last sentence end, else the last
 * whitespace, so words are not split when avoidable. The next window starts {@code overlapChars}
 * before the cut, aligned forward to a word start. Pure and deterministic.
 */
final class FixedSizeSplitter {

  private FixedSizeSplitter() {}

  static List<String> split(String text, int windowChars, int overlapChars) {
    if (windowChars < 1) {
      throw new IllegalArgumentException("windowChars must be positive");
    }
    String body = text.strip();
    if (body.isEmpty()) {
      return List.of();
    }
    if (body.length() <= windowChars) {
      return List.of(body);
    }

    List<String> pieces = new ArrayList<>();
    int length = body.length();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + windowChars, length);
      if (end < length) {
        int cut = lastBoundary(body, start + windowChars / 2, end);
        if (cut > start) {
          end = cut;
        }
      }
      String piece = body.substring(start, end).strip();
      if (!piece.isEmpty()) {
        pieces.add(piece);
      }
      if (end >= length) {
        break;
      }
      int next = end - overlapChars;
      if (next <= start) {
        next = end;
      }
      start = alignToWordStart(body, next, end);
    }
    return pieces;
  }

  /** Returns the preferred cut position in {@code (from, to]}, or -1 if there is none. */
  private static int lastBoundary(String text, int from, int to) {
    int paragraph = text.lastIndexOf("\n\n", to - 2);
    if (paragraph >= from) {
      return paragraph + 2;
    }
    for (int i = to - 1; i >= from; i--) {
      char c = text.charAt(i);
      if ((c == '.' || c == '!' || c == '?')
          && i + 1 < text.length()
          && Character.isWhitespace(text.charAt(i + 1))) {
        return i + 1;
      }
    }
    for (int i = to - 1; i >= from; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  private static int alignToWordStart(String text, int position, int limit) {
    if (position == 0 || Character.isWhitespace(text.charAt(position - 1))) {
      return position;
    }
    for (int i = position; i < limit; i++) {
      if (Character.isWhitespace(text.charAt(i))) {
        int j = i;
        while (j < limit && Character.isWhitespace(text.charAt(j))) {
          j++;
        }
        return j;
      }
    }
    return position;
  }
}

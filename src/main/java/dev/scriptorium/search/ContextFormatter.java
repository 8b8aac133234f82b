package dev.scriptorium.search;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Formats ranked results as the context handed to answer generation: one {@code "[Source n:
 * title]\ncontent"} block per result, numbered from 1 in rank order, separated by blank lines.
 */
public final class ContextFormatter {

  static final String NO_RESULTS = "No relevant information found in the knowledge base.";

  private ContextFormatter() {}

  public static String format(List<SearchResult> results) {
    if (results.isEmpty()) {
      return NO_RESULTS;
    }
    return IntStream.range(0, results.size())
        .mapToObj(
            i ->
                "[Source "
                    + (i + 1)
                    + ": "
                    + results.get(i).documentTitle()
                    + "]\n"
                    + results.get(i).content())
        .collect(Collectors.joining("\n\n"));
  }
}

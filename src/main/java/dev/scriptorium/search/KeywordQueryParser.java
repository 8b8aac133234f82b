package dev.scriptorium.search;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Turns free query text into keywords: lower-cases, strips punctuation, drops tokens shorter than
 * three characters and English stop words, and removes duplicates keeping first occurrence.
 */
public final class KeywordQueryParser {

  static final int MIN_TOKEN_LENGTH = 3;

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  static final Set<String> STOP_WORDS =
      Set.of(
          "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her",
          "was", "one", "our", "out", "has", "have", "him", "his", "how", "its", "may", "who",
          "did", "get", "let", "she", "too", "use", "been", "from", "into", "more", "much",
          "that", "than", "them", "then", "there", "these", "they", "this", "those", "were",
          "what", "when", "where", "which", "while", "with", "would", "could", "should", "about",
          "after", "again", "also", "being", "does", "each", "here", "just", "only", "other",
          "over", "some", "such", "their", "very", "will", "your", "yours", "whom", "why");

  private KeywordQueryParser() {}

  /**
   * Extracts keywords from a query.
   *
   * @param query raw query text, null treated as empty
   * @return keywords in first-seen order, empty when nothing meaningful remains
   */
  public static List<String> parse(@Nullable String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    String cleaned = NON_WORD.matcher(query.toLowerCase(Locale.ROOT)).replaceAll(" ");
    Set<String> keywords = new LinkedHashSet<>();
    for (String token : WHITESPACE.split(cleaned.strip())) {
      if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
        keywords.add(token);
      }
    }
    return List.copyOf(keywords);
  }
}

package dev.scriptorium.ingestion.chunking;

/**
 * Character-based token estimation (chars / 4), the usual approximation for English text.
 * Deterministic and model-agnostic, which keeps chunk boundaries reproducible.
 */
public final class TokenEstimator {

  static final int CHARS_PER_TOKEN = 4;

  private TokenEstimator() {}

  public static int estimate(String text) {
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  /** Largest character count whose estimate stays within {@code maxTokens}. */
  public static int maxCharsFor(int maxTokens) {
    return maxTokens * CHARS_PER_TOKEN;
  }
}

package dev.scriptorium.document;

import org.jspecify.annotations.Nullable;

/**
 * Conversion between {@code float[]} and the pgvector text literal ({@code [0.1,0.2,...]}) used by
 * native queries, with dimension and finiteness checks applied before anything reaches SQL.
 */
public final class PgVectors {

  private PgVectors() {}

  /**
   * Formats a vector as a pgvector literal after checking it against the expected dimension.
   *
   * @throws EmbeddingIntegrityException on dimension mismatch or non-finite components
   */
  public static String toLiteral(float[] vector, int expectedDimension) {
    checkDimension(vector, expectedDimension);
    StringBuilder sb = new StringBuilder(vector.length * 10 + 2).append('[');
    for (int i = 0; i < vector.length; i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(vector[i]);
    }
    return sb.append(']').toString();
  }

  /**
   * Checks that a vector has exactly {@code expectedDimension} finite components.
   *
   * @throws EmbeddingIntegrityException otherwise
   */
  public static void checkDimension(float[] vector, int expectedDimension) {
    if (vector.length != expectedDimension) {
      throw EmbeddingIntegrityException.dimensionMismatch(expectedDimension, vector.length);
    }
    for (float component : vector) {
      if (!Float.isFinite(component)) {
        throw new EmbeddingIntegrityException("Embedding contains non-finite component");
      }
    }
  }

  /** Parses a pgvector text literal; returns null for a null input. */
  public static float @Nullable [] parse(@Nullable String literal) {
    if (literal == null) {
      return null;
    }
    String body = literal.trim();
    if (body.startsWith("[")) {
      body = body.substring(1);
    }
    if (body.endsWith("]")) {
      body = body.substring(0, body.length() - 1);
    }
    if (body.isBlank()) {
      return new float[0];
    }
    String[] parts = body.split(",");
    float[] vector = new float[parts.length];
    for (int i = 0; i < parts.length; i++) {
      vector[i] = Float.parseFloat(parts[i].trim());
    }
    return vector;
  }
}

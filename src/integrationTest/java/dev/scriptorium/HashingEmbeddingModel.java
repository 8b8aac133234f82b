package dev.scriptorium;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic bag-of-words embedding for integration tests. Each word (lower-cased, trailing
 * "s" dropped) is hashed into one dimension; the last dimension carries a small constant so no
 * vector is ever zero. Texts sharing words have positive cosine similarity.
 */
public class HashingEmbeddingModel implements EmbeddingModel {

  private final int dimension;

  public HashingEmbeddingModel(int dimension) {
    this.dimension = dimension;
  }

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
    return Response.from(segments.stream().map(segment -> embedText(segment.text())).toList());
  }

  @Override
  public int dimension() {
    return dimension;
  }

  public Embedding embedText(String text) {
    float[] vector = new float[dimension];
    vector[dimension - 1] = 0.05f;
    for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (token.length() < 3) {
        continue;
      }
      String word = token.endsWith("s") ? token.substring(0, token.length() - 1) : token;
      vector[Math.floorMod(word.hashCode(), dimension - 1)] += 1f;
    }
    double norm = 0;
    for (float component : vector) {
      norm += component * component;
    }
    float scale = (float) (1.0 / Math.sqrt(norm));
    for (int i = 0; i < vector.length; i++) {
      vector[i] *= scale;
    }
    return Embedding.from(vector);
  }
}

package com.flamingo.ai.ragpipeline.service.rag.embedding;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.service.rag.TextAnalyzer;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic, CPU-only embedder based on feature hashing.
 *
 * <p>Each token and each pair of adjacent tokens is hashed with Murmur3 into one of {@code
 * dimension} buckets, with the sign taken from a second hash bit; the result is L2-normalised.
 * Texts sharing vocabulary end up close in cosine space. Useful offline and in tests, not a
 * substitute for a trained model. A text without tokens yields the zero vector.
 */
public class HashingEmbedder implements Embedder {

  public static final String TYPE = "HashingEmbedder";

  private static final HashFunction HASH = Hashing.murmur3_32_fixed();

  private final int dimension;
  private final int batchSize;

  public HashingEmbedder(int dimension, int batchSize) {
    if (dimension <= 0) {
      throw new ConfigurationException("dimension must be positive");
    }
    this.dimension = dimension;
    this.batchSize = Math.max(1, batchSize);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public int batchSize() {
    return batchSize;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embedOne(text));
    }
    return vectors;
  }

  private float[] embedOne(String text) {
    float[] vector = new float[dimension];
    List<String> tokens = TextAnalyzer.tokenize(text);
    String previous = null;
    for (String token : tokens) {
      addFeature(vector, token, 1.0f);
      if (previous != null) {
        addFeature(vector, previous + ' ' + token, 0.5f);
      }
      previous = token;
    }
    normalize(vector);
    return vector;
  }

  private void addFeature(float[] vector, String feature, float weight) {
    int hash = HASH.hashString(feature, StandardCharsets.UTF_8).asInt();
    int bucket = Math.floorMod(hash, dimension);
    vector[bucket] += (hash & 0x8000_0000) == 0 ? weight : -weight;
  }

  private static void normalize(float[] vector) {
    double sumOfSquares = 0;
    for (float v : vector) {
      sumOfSquares += v * v;
    }
    if (sumOfSquares == 0) {
      return;
    }
    float norm = (float) Math.sqrt(sumOfSquares);
    for (int i = 0; i < vector.length; i++) {
      vector[i] /= norm;
    }
  }
}

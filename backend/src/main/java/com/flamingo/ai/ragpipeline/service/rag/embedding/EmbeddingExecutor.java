package com.flamingo.ai.ragpipeline.service.rag.embedding;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an {@link Embedder} in batches behind a Resilience4j retry and circuit breaker.
 *
 * <p>Both are created from the {@value #CONFIG_NAME} configuration of their registries (the
 * registry default when absent) and only react to transient failures. When retries are exhausted
 * the whole call fails with a transient {@link EmbeddingException}. A batch rejected permanently
 * is re-embedded one text at a time so that only the offending texts are marked failed.
 */
@Slf4j
public class EmbeddingExecutor {

  public static final String CONFIG_NAME = "embedding";

  private final Embedder embedder;
  private final Retry retry;
  private final CircuitBreaker circuitBreaker;
  private final MeterRegistry meterRegistry;

  public EmbeddingExecutor(
      String name,
      Embedder embedder,
      RetryRegistry retryRegistry,
      CircuitBreakerRegistry circuitBreakerRegistry,
      MeterRegistry meterRegistry) {
    this.embedder = embedder;
    this.meterRegistry = meterRegistry;
    TransientEmbeddingFailurePredicate transientFailure = new TransientEmbeddingFailurePredicate();

    RetryConfig retryConfig =
        RetryConfig.from(
                retryRegistry
                    .getConfiguration(CONFIG_NAME)
                    .orElse(retryRegistry.getDefaultConfig()))
            .retryOnException(transientFailure)
            .build();
    this.retry = retryRegistry.retry(CONFIG_NAME + "-" + name, retryConfig);

    CircuitBreakerConfig breakerConfig =
        CircuitBreakerConfig.from(
                circuitBreakerRegistry
                    .getConfiguration(CONFIG_NAME)
                    .orElse(circuitBreakerRegistry.getDefaultConfig()))
            .recordException(transientFailure)
            .build();
    this.circuitBreaker =
        circuitBreakerRegistry.circuitBreaker(CONFIG_NAME + "-" + name, breakerConfig);
  }

  public Embedder getEmbedder() {
    return embedder;
  }

  public int dimension() {
    return embedder.dimension();
  }

  /**
   * Embeds passages in batches of the embedder's batch size.
   *
   * @param texts texts to embed
   * @return vectors aligned with {@code texts}; permanently rejected or invalid vectors are
   *     reported as failures
   * @throws EmbeddingException if the backend stays unavailable
   * @throws ConfigurationException if the backend returns vectors of the wrong dimension
   */
  public EmbeddingResult embedAll(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    Map<Integer, String> failures = new HashMap<>();
    int batchSize = embedder.batchSize();

    for (int start = 0; start < texts.size(); start += batchSize) {
      int end = Math.min(texts.size(), start + batchSize);
      List<String> batch = texts.subList(start, end);
      List<float[]> batchVectors;
      try {
        batchVectors = call(batch);
      } catch (EmbeddingException e) {
        if (e.isTransientFailure()) {
          throw e;
        }
        log.warn(
            "Batch [{}..{}] rejected by {}, embedding texts individually: {}",
            start,
            end - 1,
            embedder.type(),
            e.getMessage());
        batchVectors = embedIndividually(batch, start, failures);
      }
      for (int i = 0; i < batchVectors.size(); i++) {
        int position = start + i;
        float[] vector = batchVectors.get(i);
        if (vector != null && !isUsable(vector)) {
          failures.put(position, "invalid embedding");
          vector = null;
        }
        vectors.add(vector);
      }
    }
    meterRegistry.counter("embedding.texts", "embedder", embedder.type()).increment(texts.size());
    if (!failures.isEmpty()) {
      meterRegistry
          .counter("embedding.texts.failed", "embedder", embedder.type())
          .increment(failures.size());
    }
    return new EmbeddingResult(vectors, failures);
  }

  /**
   * Embeds a single query text.
   *
   * @throws EmbeddingException if the text cannot be embedded
   */
  public float[] embedQuery(String query) {
    float[] vector = call(List.of(query)).get(0);
    if (!isUsable(vector)) {
      throw EmbeddingException.permanentFailure("Query produced an invalid embedding", null);
    }
    return vector;
  }

  private List<float[]> embedIndividually(
      List<String> batch, int offset, Map<Integer, String> failures) {
    List<float[]> vectors = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      try {
        vectors.add(call(List.of(batch.get(i))).get(0));
      } catch (EmbeddingException e) {
        if (e.isTransientFailure()) {
          throw e;
        }
        failures.put(offset + i, e.getMessage());
        vectors.add(null);
      }
    }
    return vectors;
  }

  private List<float[]> call(List<String> texts) {
    Supplier<List<float[]>> guarded =
        Retry.decorateSupplier(
            retry, CircuitBreaker.decorateSupplier(circuitBreaker, () -> invoke(texts)));
    List<float[]> vectors;
    try {
      vectors = guarded.get();
    } catch (CallNotPermittedException e) {
      throw EmbeddingException.transientFailure(
          "Circuit breaker " + circuitBreaker.getName() + " is open", e);
    }
    for (float[] vector : vectors) {
      if (vector.length != embedder.dimension()) {
        throw new ConfigurationException(
            embedder.type()
                + " returned a vector of dimension "
                + vector.length
                + ", expected "
                + embedder.dimension());
      }
    }
    return vectors;
  }

  private List<float[]> invoke(List<String> texts) {
    List<float[]> vectors;
    try {
      vectors = embedder.embed(texts);
    } catch (EmbeddingException | ConfigurationException e) {
      throw e;
    } catch (RuntimeException e) {
      boolean transientFailure = new TransientEmbeddingFailurePredicate().test(e);
      throw new EmbeddingException(
          embedder.type() + " failed: " + e.getMessage(), transientFailure, e);
    }
    if (vectors == null || vectors.size() != texts.size()) {
      throw EmbeddingException.permanentFailure(
          embedder.type()
              + " returned "
              + (vectors == null ? 0 : vectors.size())
              + " vectors for "
              + texts.size()
              + " texts",
          null);
    }
    return vectors;
  }

  static boolean isUsable(float[] vector) {
    boolean nonZero = false;
    for (float v : vector) {
      if (!Float.isFinite(v)) {
        return false;
      }
      if (v != 0.0f) {
        nonZero = true;
      }
    }
    return nonZero;
  }
}

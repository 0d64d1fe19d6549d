package com.flamingo.ai.ragpipeline.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingExecutor Tests")
class EmbeddingExecutorTest {

  @Mock private Embedder embedder;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingExecutor executor;

  @BeforeEach
  void setUp() {
    lenient().when(embedder.type()).thenReturn("TestEmbedder");
    lenient().when(embedder.dimension()).thenReturn(3);
    lenient().when(embedder.batchSize()).thenReturn(2);
    meterRegistry = new SimpleMeterRegistry();
    RetryRegistry retryRegistry =
        RetryRegistry.of(
            Map.of(
                EmbeddingExecutor.CONFIG_NAME,
                RetryConfig.custom().maxAttempts(3).waitDuration(Duration.ofMillis(1)).build()));
    executor =
        new EmbeddingExecutor(
            "test_db", embedder, retryRegistry, CircuitBreakerRegistry.ofDefaults(), meterRegistry);
  }

  private static List<float[]> vectors(int count) {
    List<float[]> vectors = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      vectors.add(new float[] {1f, i, 0f});
    }
    return vectors;
  }

  @Nested
  @DisplayName("Batching")
  class Batching {

    @Test
    @DisplayName("should send texts in batches of the embedder's batch size")
    void shouldEmbedInBatches() {
      when(embedder.embed(anyList()))
          .thenAnswer(inv -> vectors(inv.<List<?>>getArgument(0).size()));

      EmbeddingResult result = executor.embedAll(List.of("a", "b", "c", "d", "e"));

      assertThat(result.vectors()).hasSize(5);
      assertThat(result.failedCount()).isZero();
      verify(embedder, times(3)).embed(anyList());
      assertThat(meterRegistry.counter("embedding.texts", "embedder", "TestEmbedder").count())
          .isEqualTo(5.0);
    }

    @Test
    @DisplayName("should return an empty result for no texts")
    void shouldHandleNoTexts() {
      EmbeddingResult result = executor.embedAll(List.of());

      assertThat(result.vectors()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Failure handling")
  class FailureHandling {

    @Test
    @DisplayName("should retry transient failures")
    void shouldRetryTransientFailures() {
      when(embedder.embed(anyList()))
          .thenThrow(new RuntimeException("connection reset"))
          .thenReturn(vectors(1));

      float[] vector = executor.embedQuery("hello");

      assertThat(vector).hasSize(3);
      verify(embedder, times(2)).embed(anyList());
    }

    @Test
    @DisplayName("should surface a transient failure once retries are exhausted")
    void shouldFailAfterRetries() {
      when(embedder.embed(anyList())).thenThrow(new RuntimeException("503 Service Unavailable"));

      assertThatThrownBy(() -> executor.embedAll(List.of("a", "b")))
          .isInstanceOfSatisfying(
              EmbeddingException.class, e -> assertThat(e.isTransientFailure()).isTrue());
      verify(embedder, times(3)).embed(anyList());
    }

    @Test
    @DisplayName("should embed texts one by one when a batch is rejected")
    void shouldSplitRejectedBatch() {
      when(embedder.batchSize()).thenReturn(3);
      when(embedder.embed(anyList()))
          .thenAnswer(
              inv -> {
                List<String> texts = inv.getArgument(0);
                if (texts.contains("too long")) {
                  throw new IllegalArgumentException("input exceeds context window");
                }
                return vectors(texts.size());
              });

      EmbeddingResult result = executor.embedAll(List.of("ok", "too long", "fine"));

      assertThat(result.vectors()).hasSize(3);
      assertThat(result.vectors().get(0)).isNotNull();
      assertThat(result.vectors().get(1)).isNull();
      assertThat(result.vectors().get(2)).isNotNull();
      assertThat(result.isFailed(1)).isTrue();
      assertThat(result.failures().get(1)).contains("context window");
    }

    @Test
    @DisplayName("should mark zero vectors as failed")
    void shouldRejectZeroVectors() {
      when(embedder.embed(anyList()))
          .thenReturn(List.of(new float[] {0f, 0f, 0f}, new float[] {1f, 0f, 0f}));

      EmbeddingResult result = executor.embedAll(List.of("!!", "word"));

      assertThat(result.isFailed(0)).isTrue();
      assertThat(result.failures().get(0)).isEqualTo("invalid embedding");
      assertThat(result.isFailed(1)).isFalse();
    }

    @Test
    @DisplayName("should reject vectors of the wrong dimension as a configuration error")
    void shouldRejectWrongDimension() {
      when(embedder.embed(anyList())).thenReturn(List.of(new float[] {1f, 2f}));

      assertThatThrownBy(() -> executor.embedQuery("hello"))
          .isInstanceOf(ConfigurationException.class)
          .hasMessageContaining("dimension 2");
    }
  }
}

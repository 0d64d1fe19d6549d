package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingExecutor;
import com.flamingo.ai.ragpipeline.service.rag.rerank.LexicalOverlapScorer;
import com.flamingo.ai.ragpipeline.service.rag.rerank.PairwiseScorer;
import com.flamingo.ai.ragpipeline.service.rag.store.InMemoryStore;
import com.flamingo.ai.ragpipeline.service.rag.store.MetadataFilters;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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
@DisplayName("Retrieval strategy Tests")
class RetrievalStrategiesTest {

  private static final float[] QUERY_VECTOR = {1f, 0f, 0f};

  @Mock private EmbeddingExecutor embedder;

  @Mock private PairwiseScorer scorer;

  private InMemoryStore store;
  private RetrievalContext context;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    lenient().when(embedder.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
    meterRegistry = new SimpleMeterRegistry();
    store = new InMemoryStore("main_database", 3);
    store.upsertDocument(
        "d1",
        List.of(
            record("d1", 0, "billing cycles start monthly", "PdfParser", 1f, 0f, 0f),
            record("d1", 1, "refund policy for annual plans", "PdfParser", 0.8f, 0.6f, 0f)));
    store.upsertDocument(
        "d2",
        List.of(
            record("d2", 0, "release notes for version two", "TextParser", 0.6f, 0.8f, 0f),
            record("d2", 1, "invoice refund requests", "TextParser", 0f, 0f, 1f)));
    context = new RetrievalContext("main_database", embedder, store);
  }

  private static VectorRecord record(
      String doc, int index, String text, String parser, float... vector) {
    return new VectorRecord(
        doc + "_" + index,
        doc,
        index,
        text,
        "h" + doc + index,
        Map.of("parser", parser, "chunk_index", index),
        vector);
  }

  @Nested
  @DisplayName("SemanticRetrieval")
  class Semantic {

    @Test
    @DisplayName("should return the nearest chunks by cosine similarity")
    void shouldReturnNearestChunks() {
      List<RetrievedChunk> results =
          new SemanticRetrieval("semantic").retrieve(RetrievalRequest.of("billing", 2), context);

      assertThat(results).extracting(RetrievedChunk::id).containsExactly("d1_0", "d1_1");
      assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("should reject a blank query or non positive top k")
    void shouldValidateRequest() {
      assertThatThrownBy(() -> RetrievalRequest.of(" ", 5))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> RetrievalRequest.of("q", 0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("FilteredRetrieval")
  class Filtered {

    @Test
    @DisplayName("should only return chunks matching the configured filter")
    void shouldApplyConfiguredFilter() {
      FilteredRetrieval textOnly =
          new FilteredRetrieval(
              "text_only", MetadataFilters.fromMap(Map.of("parser", "TextParser")), 1);

      List<RetrievedChunk> results = textOnly.retrieve(RetrievalRequest.of("refund", 10), context);

      assertThat(results).extracting(RetrievedChunk::id).containsExactly("d2_0", "d2_1");
      assertThat(results)
          .allSatisfy(r -> assertThat(r.metadata()).containsEntry("parser", "TextParser"));
    }

    @Test
    @DisplayName("should combine the configured filter with the request filter")
    void shouldCombineWithRequestFilter() {
      FilteredRetrieval filtered =
          new FilteredRetrieval("f", MetadataFilters.fromMap(Map.of("parser", "PdfParser")), 1);
      RetrievalRequest request =
          new RetrievalRequest(
              "refund", 10, MetadataFilters.fromMap(Map.of("chunk_index", 1)));

      assertThat(filtered.retrieve(request, context))
          .extracting(RetrievedChunk::id)
          .containsExactly("d1_1");
    }

    @Test
    @DisplayName("should return an empty list when nothing matches")
    void shouldReturnEmptyWhenNothingMatches() {
      FilteredRetrieval filtered =
          new FilteredRetrieval("f", MetadataFilters.fromMap(Map.of("parser", "TikaParser")), 1);

      assertThat(filtered.retrieve(RetrievalRequest.of("refund", 10), context)).isEmpty();
    }
  }

  @Nested
  @DisplayName("HybridRetrieval")
  class Hybrid {

    @Test
    @DisplayName("should surface lexical matches the vector search ranked low")
    void shouldBlendLexicalMatches() {
      HybridRetrieval hybrid = new HybridRetrieval("hybrid", 0.5, 0.5, 1);

      List<RetrievedChunk> results =
          hybrid.retrieve(RetrievalRequest.of("invoice refund requests", 1), context);

      assertThat(results).extracting(RetrievedChunk::id).containsExactly("d2_1");
      assertThat(results.get(0).metadata()).containsKeys("dense_score", "sparse_score");
    }

    @Test
    @DisplayName("should break combined score ties by dense score then id")
    void shouldBreakTies() {
      VectorRecord a = record("x", 0, "a", "TextParser", 1f, 0f, 0f);
      VectorRecord b = record("y", 0, "b", "TextParser", 1f, 0f, 0f);
      VectorRecord c = record("z", 0, "c", "TextParser", 1f, 0f, 0f);
      List<HybridRetrieval.Scored> scored =
          List.of(
              new HybridRetrieval.Scored(c, 0.6, 0.4, 0.5),
              new HybridRetrieval.Scored(b, 0.6, 0.4, 0.5),
              new HybridRetrieval.Scored(a, 0.4, 0.6, 0.5));

      List<HybridRetrieval.Scored> ranked = HybridRetrieval.rank(scored, 3);

      assertThat(ranked)
          .extracting(s -> s.record().id())
          .containsExactly("y_0", "z_0", "x_0");
    }

    @Test
    @DisplayName("should reject weights that are negative or both zero")
    void shouldRejectInvalidWeights() {
      assertThatThrownBy(() -> new HybridRetrieval("h", 0, 0, 1))
          .isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> new HybridRetrieval("h", -1, 1, 1))
          .isInstanceOf(ConfigurationException.class);
    }
  }

  @Nested
  @DisplayName("RerankedRetrieval")
  class Reranked {

    @Test
    @DisplayName("should reorder candidates by the scorer")
    void shouldReorderByScorer() {
      RerankedRetrieval reranked =
          new RerankedRetrieval("reranked", new LexicalOverlapScorer(), 3, null, meterRegistry);

      List<RetrievedChunk> results =
          reranked.retrieve(RetrievalRequest.of("refund policy", 1), context);

      assertThat(results).extracting(RetrievedChunk::id).containsExactly("d1_1");
      assertThat(results.get(0).metadata())
          .containsKeys("reranker_score", "initial_score")
          .containsEntry("rerank_position", 1);
      assertThat(reranked.isReranker()).isTrue();
    }

    @Test
    @DisplayName("should fall back to the initial ranking when the scorer fails")
    void shouldFallBackWhenScorerFails() {
      when(scorer.type()).thenReturn("tei");
      when(scorer.score(anyString(), anyList())).thenThrow(new IllegalStateException("down"));
      RerankedRetrieval reranked =
          new RerankedRetrieval("reranked", scorer, 3, null, meterRegistry);

      List<RetrievedChunk> results =
          reranked.retrieve(RetrievalRequest.of("billing", 2), context);

      assertThat(results).extracting(RetrievedChunk::id).containsExactly("d1_0", "d1_1");
      assertThat(meterRegistry.counter("rag.reranker.fallback", "scorer", "tei").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should drop results below the relevance threshold")
    void shouldApplyRelevanceThreshold() {
      lenient().when(scorer.type()).thenReturn("fixed");
      when(scorer.score(anyString(), anyList())).thenReturn(List.of(0.9, 0.2, 0.1, 0.05));
      RerankedRetrieval reranked =
          new RerankedRetrieval("reranked", scorer, 3, 0.5, meterRegistry);

      List<RetrievedChunk> results =
          reranked.retrieve(RetrievalRequest.of("billing", 3), context);

      assertThat(results).extracting(RetrievedChunk::score).containsExactly(0.9);
    }

    @Test
    @DisplayName("should clamp the candidate multiplier")
    void shouldClampCandidateMultiplier() {
      RerankedRetrieval low = new RerankedRetrieval("r", scorer, 1, null, meterRegistry);
      RerankedRetrieval high = new RerankedRetrieval("r", scorer, 9, null, meterRegistry);

      assertThat(low.getCandidateMultiplier()).isEqualTo(3);
      assertThat(high.getCandidateMultiplier()).isEqualTo(5);
    }
  }
}

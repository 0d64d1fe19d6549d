package com.flamingo.ai.ragpipeline.service.rag.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TeiCrossEncoderScorer Tests")
class TeiCrossEncoderScorerTest {

  @Mock private TeiRerankerClient teiRerankerClient;

  private CircuitBreaker circuitBreaker;
  private TeiCrossEncoderScorer scorer;

  @BeforeEach
  void setUp() {
    circuitBreaker = CircuitBreaker.ofDefaults("tei");
    scorer = new TeiCrossEncoderScorer(teiRerankerClient, circuitBreaker);
  }

  @Test
  @DisplayName("Should map TEI scores back to input order")
  void shouldMapScoresToInputOrder() {
    when(teiRerankerClient.rerank(anyString(), anyList()))
        .thenReturn(
            List.of(
                new TeiRerankerClient.RerankResult(1, 0.95),
                new TeiRerankerClient.RerankResult(2, 0.60),
                new TeiRerankerClient.RerankResult(0, 0.15)));

    List<Double> scores =
        scorer.score("machine learning", List.of("low", "high about machine learning", "medium"));

    assertThat(scores).containsExactly(0.15, 0.95, 0.60);
  }

  @Test
  @DisplayName("Should fail when TEI leaves texts unscored")
  void shouldFailOnMissingScores() {
    when(teiRerankerClient.rerank(anyString(), anyList()))
        .thenReturn(List.of(new TeiRerankerClient.RerankResult(0, 0.5)));

    assertThatThrownBy(() -> scorer.score("q", List.of("a", "b")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("1 of 2");
  }

  @Test
  @DisplayName("Should not call TEI for an empty candidate list")
  void shouldSkipEmptyCandidates() {
    assertThat(scorer.score("q", List.of())).isEmpty();
    verify(teiRerankerClient, never()).rerank(anyString(), anyList());
  }

  @Test
  @DisplayName("Should fail fast while the circuit is open")
  void shouldFailFastWhenCircuitOpen() {
    circuitBreaker.transitionToOpenState();

    assertThatThrownBy(() -> scorer.score("q", List.of("a")))
        .isInstanceOf(CallNotPermittedException.class);
    verify(teiRerankerClient, never()).rerank(anyString(), anyList());
  }
}

package com.flamingo.ai.ragpipeline.service.rag.rerank;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Cross-encoder scorer served by a TEI container. Calls go through the {@code tei} circuit
 * breaker so an unreachable container fails fast; callers fall back to the initial ranking.
 */
@Slf4j
public class TeiCrossEncoderScorer implements PairwiseScorer {

  public static final String TYPE = "tei";

  private final TeiRerankerClient client;
  private final CircuitBreaker circuitBreaker;

  public TeiCrossEncoderScorer(TeiRerankerClient client, CircuitBreaker circuitBreaker) {
    this.client = client;
    this.circuitBreaker = circuitBreaker;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<Double> score(String query, List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TeiRerankerClient.RerankResult> results =
        circuitBreaker.executeSupplier(() -> client.rerank(query, texts));
    List<Double> scores = new ArrayList<>(Collections.nCopies(texts.size(), (Double) null));
    if (results != null) {
      for (TeiRerankerClient.RerankResult result : results) {
        if (result.index() >= 0 && result.index() < texts.size()) {
          scores.set(result.index(), result.score());
        }
      }
    }
    if (scores.contains(null)) {
      int returned = results == null ? 0 : results.size();
      throw new IllegalStateException(
          "TEI returned scores for " + returned + " of " + texts.size() + " texts");
    }
    log.debug("TEI scored {} texts", texts.size());
    return scores;
  }
}

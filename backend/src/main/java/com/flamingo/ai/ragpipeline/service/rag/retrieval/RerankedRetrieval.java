package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.service.rag.rerank.PairwiseScorer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-stage retrieval: a semantic candidate set of {@code topK * candidate-multiplier} chunks is
 * rescored by a {@link PairwiseScorer} and the best {@code topK} are returned.
 *
 * <p>Every result carries {@code reranker_score}, {@code initial_score} and {@code
 * rerank_position}. Results below {@code relevance-threshold} are dropped. When the scorer fails
 * the candidates are returned in their initial order.
 */
@Slf4j
public class RerankedRetrieval implements RetrievalStrategy {

  public static final String TYPE = "CrossEncoderRerankedStrategy";

  public static final int DEFAULT_CANDIDATE_MULTIPLIER = 4;
  static final int MIN_CANDIDATE_MULTIPLIER = 3;
  static final int MAX_CANDIDATE_MULTIPLIER = 5;

  private final String name;
  private final SemanticRetrieval initialStage;
  private final PairwiseScorer scorer;
  private final int candidateMultiplier;
  private final Double relevanceThreshold;
  private final MeterRegistry meterRegistry;

  public RerankedRetrieval(
      String name,
      PairwiseScorer scorer,
      int candidateMultiplier,
      Double relevanceThreshold,
      MeterRegistry meterRegistry) {
    this.name = name;
    this.initialStage = new SemanticRetrieval(name + "-candidates");
    this.scorer = scorer;
    this.candidateMultiplier =
        Math.max(MIN_CANDIDATE_MULTIPLIER, Math.min(MAX_CANDIDATE_MULTIPLIER, candidateMultiplier));
    this.relevanceThreshold = relevanceThreshold;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isReranker() {
    return true;
  }

  int getCandidateMultiplier() {
    return candidateMultiplier;
  }

  @Override
  public List<RetrievedChunk> retrieve(RetrievalRequest request, RetrievalContext context) {
    RetrievalRequest candidateRequest =
        new RetrievalRequest(
            request.query(), request.topK() * candidateMultiplier, request.filter());
    List<RetrievedChunk> candidates = initialStage.retrieve(candidateRequest, context);
    if (candidates.isEmpty()) {
      return List.of();
    }

    List<Double> scores;
    try {
      List<String> texts = candidates.stream().map(RetrievedChunk::text).toList();
      scores = scorer.score(request.query(), texts);
    } catch (RuntimeException e) {
      log.warn(
          "{} reranker unavailable, using initial ranking as fallback: {}",
          scorer.type(),
          e.getMessage());
      meterRegistry.counter("rag.reranker.fallback", "scorer", scorer.type()).increment();
      return candidates.stream().limit(request.topK()).toList();
    }

    List<RetrievedChunk> rescored = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      RetrievedChunk candidate = candidates.get(i);
      double rerankerScore = scores.get(i);
      rescored.add(
          candidate
              .withMetadata(
                  Map.of("reranker_score", rerankerScore, "initial_score", candidate.score()))
              .withScore(rerankerScore));
    }
    rescored.sort(
        Comparator.comparingDouble(RetrievedChunk::score)
            .reversed()
            .thenComparing(RetrievedChunk::id));

    List<RetrievedChunk> results = new ArrayList<>();
    for (RetrievedChunk chunk : rescored) {
      if (results.size() == request.topK()) {
        break;
      }
      if (relevanceThreshold != null && chunk.score() < relevanceThreshold) {
        continue;
      }
      results.add(chunk.withMetadata(Map.of("rerank_position", results.size() + 1)));
    }
    meterRegistry.counter("rag.reranker.invocations", "scorer", scorer.type()).increment();
    log.debug(
        "{}: reranked {} candidates, returning {}", name, candidates.size(), results.size());
    return results;
  }
}

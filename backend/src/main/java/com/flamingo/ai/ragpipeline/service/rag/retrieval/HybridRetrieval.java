package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.service.rag.TextAnalyzer;
import com.flamingo.ai.ragpipeline.service.rag.store.ScoredRecord;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorRecord;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Combines dense and lexical relevance.
 *
 * <p>Candidates are the union of the top {@code topK * candidate-multiplier} vector hits and
 * lexical hits. Each candidate is scored {@code dense-weight * (cos + 1) / 2 + sparse-weight *
 * overlap}, where overlap is the fraction of distinct query terms present in the chunk. Ties are
 * broken by dense score, then by chunk id.
 */
@Slf4j
public class HybridRetrieval implements RetrievalStrategy {

  public static final String TYPE = "HybridUniversalStrategy";

  public static final double DEFAULT_DENSE_WEIGHT = 0.7;
  public static final double DEFAULT_SPARSE_WEIGHT = 0.3;

  private final String name;
  private final double denseWeight;
  private final double sparseWeight;
  private final int candidateMultiplier;

  public HybridRetrieval(
      String name, double denseWeight, double sparseWeight, int candidateMultiplier) {
    if (denseWeight < 0 || sparseWeight < 0 || denseWeight + sparseWeight == 0) {
      throw new ConfigurationException("weights must be non-negative and not both zero");
    }
    this.name = name;
    this.denseWeight = denseWeight;
    this.sparseWeight = sparseWeight;
    this.candidateMultiplier = Math.max(1, candidateMultiplier);
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
  public List<RetrievedChunk> retrieve(RetrievalRequest request, RetrievalContext context) {
    int poolSize = request.topK() * candidateMultiplier;
    float[] queryVector = context.embedder().embedQuery(request.query());

    Map<String, VectorRecord> candidates = new LinkedHashMap<>();
    for (ScoredRecord hit : context.store().query(queryVector, poolSize, request.filter())) {
      candidates.putIfAbsent(hit.record().id(), hit.record());
    }
    for (ScoredRecord hit :
        context.store().lexicalQuery(request.query(), poolSize, request.filter())) {
      candidates.putIfAbsent(hit.record().id(), hit.record());
    }

    Embedding queryEmbedding = Embedding.from(queryVector);
    Set<String> queryTerms = TextAnalyzer.terms(request.query());
    List<Scored> scored = new ArrayList<>(candidates.size());
    for (VectorRecord record : candidates.values()) {
      double cosine = CosineSimilarity.between(queryEmbedding, Embedding.from(record.vector()));
      double dense = (cosine + 1) / 2;
      double sparse = TextAnalyzer.termOverlap(queryTerms, record.text());
      scored.add(new Scored(record, dense, sparse, denseWeight * dense + sparseWeight * sparse));
    }
    log.debug(
        "{}: {} candidates from {} for '{}'",
        name,
        scored.size(),
        context.databaseName(),
        request.query());

    return rank(scored, request.topK()).stream()
        .map(
            s ->
                new RetrievedChunk(
                        s.record().id(), s.record().text(), s.record().metadata(), s.combined())
                    .withMetadata(Map.of("dense_score", s.dense(), "sparse_score", s.sparse())))
        .toList();
  }

  /** Orders by combined score, then dense score, then id, and keeps the top k. */
  @VisibleForTesting
  static List<Scored> rank(List<Scored> scored, int topK) {
    return scored.stream()
        .sorted(
            Comparator.comparingDouble(Scored::combined)
                .reversed()
                .thenComparing(Comparator.comparingDouble(Scored::dense).reversed())
                .thenComparing(s -> s.record().id()))
        .limit(topK)
        .toList();
  }

  /** A candidate with its component scores. */
  record Scored(VectorRecord record, double dense, double sparse, double combined) {}
}

package com.flamingo.ai.ragpipeline.service.rag.rerank;

import java.util.List;

/** Scores query/passage pairs for reranking. */
public interface PairwiseScorer {

  /** Registry type name. */
  String type();

  /**
   * Scores each text against the query.
   *
   * @param query the query
   * @param texts candidate texts
   * @return one score per text, in input order, higher is more relevant
   * @throws RuntimeException if the scoring backend is unavailable
   */
  List<Double> score(String query, List<String> texts);
}

package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import java.util.List;

/** Turns a query into ranked chunks of one database. Implementations are stateless. */
public interface RetrievalStrategy {

  /** Registry type name. */
  String type();

  /** Configured name, unique within a database. */
  String name();

  /**
   * Retrieves chunks for a query.
   *
   * @param request the query
   * @param context the database backends
   * @return at most {@code request.topK()} results, best first; empty when nothing matches
   */
  List<RetrievedChunk> retrieve(RetrievalRequest request, RetrievalContext context);

  /** Whether this strategy rescores candidates with a second model. */
  default boolean isReranker() {
    return false;
  }
}

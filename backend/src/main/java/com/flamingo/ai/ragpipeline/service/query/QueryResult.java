package com.flamingo.ai.ragpipeline.service.query;

import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievedChunk;
import java.util.List;

/**
 * Ranked results of a query.
 *
 * @param databaseName queried database
 * @param retrievalStrategy strategy that produced the results
 * @param results results, best first
 */
public record QueryResult(
    String databaseName, String retrievalStrategy, List<RetrievedChunk> results) {

  public QueryResult {
    results = List.copyOf(results);
  }
}

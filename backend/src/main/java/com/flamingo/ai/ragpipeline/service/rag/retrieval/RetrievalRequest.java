package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.service.rag.store.MetadataFilter;
import com.flamingo.ai.ragpipeline.service.rag.store.MetadataFilters;

/**
 * A query against one database.
 *
 * @param query query text
 * @param topK maximum number of results
 * @param filter metadata constraints from the caller, never null
 */
public record RetrievalRequest(String query, int topK, MetadataFilter filter) {

  public RetrievalRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query must not be blank");
    }
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive");
    }
    filter = filter == null ? MetadataFilters.none() : filter;
  }

  public static RetrievalRequest of(String query, int topK) {
    return new RetrievalRequest(query, topK, null);
  }
}

package com.flamingo.ai.ragpipeline.service.rag.resolver;

import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingExecutor;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalContext;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalStrategy;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A configured vector database with its live components.
 *
 * @param name database name
 * @param embedder embedding executor shared by ingestion and queries
 * @param store vector store shared by every pipeline bound to this database
 * @param strategies retrieval strategies by name, in declaration order
 * @param defaultStrategy name of the strategy used when a query names none
 */
public record ResolvedDatabase(
    String name,
    EmbeddingExecutor embedder,
    VectorStore store,
    Map<String, RetrievalStrategy> strategies,
    String defaultStrategy) {

  public ResolvedDatabase {
    strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
  }

  /**
   * Looks up a retrieval strategy.
   *
   * @param strategyName strategy name, or {@code null} for the default
   * @throws IllegalArgumentException if the name is not configured for this database
   */
  public RetrievalStrategy strategy(String strategyName) {
    String key = strategyName == null || strategyName.isBlank() ? defaultStrategy : strategyName;
    RetrievalStrategy strategy = strategies.get(key);
    if (strategy == null) {
      throw new IllegalArgumentException(
          "Unknown retrieval strategy '"
              + strategyName
              + "' for database '"
              + name
              + "'. Available: "
              + strategies.keySet());
    }
    return strategy;
  }

  public RetrievalContext context() {
    return new RetrievalContext(name, embedder, store);
  }
}

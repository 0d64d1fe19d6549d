package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingExecutor;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;

/**
 * The backends a retrieval strategy runs against. Strategies hold no per-query state, so one
 * instance serves every query of its database.
 *
 * @param databaseName database being queried
 * @param embedder embeds the query with the database's embedder
 * @param store the database's vector store
 */
public record RetrievalContext(
    String databaseName, EmbeddingExecutor embedder, VectorStore store) {}

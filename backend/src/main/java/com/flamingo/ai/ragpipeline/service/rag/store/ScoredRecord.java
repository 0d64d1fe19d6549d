package com.flamingo.ai.ragpipeline.service.rag.store;

/**
 * A stored record returned by a query.
 *
 * @param record the record, including its vector
 * @param score cosine similarity for vector queries; for lexical queries a relevance whose scale
 *     depends on the store
 */
public record ScoredRecord(VectorRecord record, double score) {}

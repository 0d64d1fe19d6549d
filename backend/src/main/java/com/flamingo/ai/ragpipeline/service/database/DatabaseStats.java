package com.flamingo.ai.ragpipeline.service.database;

/**
 * Size and shape of one database.
 *
 * @param database database name
 * @param storeType registry type of the vector store
 * @param vectorCount stored vectors, one per chunk
 * @param documentCount distinct documents
 * @param chunkCount stored chunks
 * @param embeddingDimension vector dimension of the store
 * @param distanceMetric similarity used by vector search
 */
public record DatabaseStats(
    String database,
    String storeType,
    long vectorCount,
    long documentCount,
    long chunkCount,
    int embeddingDimension,
    String distanceMetric) {}

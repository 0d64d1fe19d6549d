package com.flamingo.ai.ragpipeline.service.query;

import java.util.Map;

/**
 * A retrieval query as received from a client.
 *
 * @param query query text
 * @param retrievalStrategy strategy name, null for the database default
 * @param topK maximum number of results, null for {@code rag.retrieval.default-top-k}
 * @param filters metadata filters in map form, may be null
 * @param scoreThreshold results scoring below it are dropped, may be null
 */
public record QueryCommand(
    String query,
    String retrievalStrategy,
    Integer topK,
    Map<String, Object> filters,
    Double scoreThreshold) {}

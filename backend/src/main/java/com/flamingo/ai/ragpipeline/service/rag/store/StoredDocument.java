package com.flamingo.ai.ragpipeline.service.rag.store;

/**
 * Summary of one document held by a store.
 *
 * @param documentHash content hash of the document
 * @param fileName name the content was first ingested under, or {@code null} if unknown
 * @param parser parser that produced the chunks, or {@code null} if unknown
 * @param ingestedAt ISO-8601 instant of ingestion, or {@code null} if unknown
 * @param chunkCount number of chunks stored for the document
 */
public record StoredDocument(
    String documentHash, String fileName, String parser, String ingestedAt, int chunkCount) {}

package com.flamingo.ai.ragpipeline.service.rag.extraction;

/**
 * A non-fatal problem raised while enriching one chunk.
 *
 * @param chunkIndex index of the affected chunk
 * @param extractor type of the extractor that failed
 * @param message what went wrong
 */
public record ExtractionError(int chunkIndex, String extractor, String message) {}

package com.flamingo.ai.ragpipeline.service.rag.extraction;

import java.util.Collections;
import java.util.Map;

/**
 * What an extractor sees of a chunk.
 *
 * @param fileName source file name
 * @param chunkIndex position of the chunk in its document
 * @param text chunk text
 * @param metadata metadata accumulated so far, read-only
 */
public record ExtractionContext(
    String fileName, int chunkIndex, String text, Map<String, Object> metadata) {

  public ExtractionContext {
    metadata = Collections.unmodifiableMap(metadata);
  }
}

package com.flamingo.ai.ragpipeline.service.rag.extraction;

import java.util.Map;

/** Derives metadata from a single chunk. Implementations must be thread-safe. */
public interface ChunkExtractor {

  /** Registry type name. */
  String type();

  /**
   * Extracts metadata from the chunk.
   *
   * @param context the chunk and its metadata so far
   * @return new metadata entries, empty when nothing was found; null values are ignored
   */
  Map<String, Object> extract(ExtractionContext context);
}

package com.flamingo.ai.ragpipeline.service.rag.store;

import java.util.Map;

/**
 * A chunk as persisted in a vector store.
 *
 * @param id chunk id, {@code <document hash prefix>_<chunk index>}
 * @param documentHash content hash of the source document
 * @param chunkIndex position of the chunk in its document
 * @param text chunk text
 * @param chunkHash content hash of the text
 * @param metadata chunk metadata, including reserved engine keys
 * @param vector embedding of the text
 */
public record VectorRecord(
    String id,
    String documentHash,
    int chunkIndex,
    String text,
    String chunkHash,
    Map<String, Object> metadata,
    float[] vector) {

  public VectorRecord {
    metadata = Map.copyOf(metadata);
  }
}

package com.flamingo.ai.ragpipeline.service.database;

import com.flamingo.ai.ragpipeline.service.rag.store.VectorRecord;
import java.util.List;

/** The leading chunks of a stored document. */
public record DocumentChunks(
    String database, String documentHash, int totalChunks, List<VectorRecord> chunks) {

  public DocumentChunks {
    chunks = List.copyOf(chunks);
  }
}

package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.service.rag.store.ScoredRecord;
import java.util.HashMap;
import java.util.Map;

/**
 * A ranked retrieval result.
 *
 * @param id chunk id
 * @param text chunk text
 * @param metadata chunk metadata plus any scoring details added by the strategy
 * @param score strategy specific score, higher is better
 */
public record RetrievedChunk(String id, String text, Map<String, Object> metadata, double score) {

  public RetrievedChunk {
    metadata = Map.copyOf(metadata);
  }

  public static RetrievedChunk from(ScoredRecord scored) {
    return new RetrievedChunk(
        scored.record().id(), scored.record().text(), scored.record().metadata(), scored.score());
  }

  public RetrievedChunk withScore(double newScore) {
    return new RetrievedChunk(id, text, metadata, newScore);
  }

  public RetrievedChunk withMetadata(Map<String, Object> extra) {
    Map<String, Object> merged = new HashMap<>(metadata);
    merged.putAll(extra);
    return new RetrievedChunk(id, text, merged, score);
  }
}

package com.flamingo.ai.ragpipeline.service.rag.embedding;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Vectors for a list of texts, aligned by position.
 *
 * @param vectors one entry per input text, null where embedding failed
 * @param failures failure reason by position
 */
public record EmbeddingResult(List<float[]> vectors, Map<Integer, String> failures) {

  public EmbeddingResult {
    vectors = Collections.unmodifiableList(vectors);
    failures = Map.copyOf(failures);
  }

  public boolean isFailed(int index) {
    return failures.containsKey(index);
  }

  public int failedCount() {
    return failures.size();
  }
}

package com.flamingo.ai.ragpipeline.service.rag.embedding;

import java.util.List;

/**
 * Turns texts into dense vectors of a fixed dimension.
 *
 * <p>Implementations must return exactly one vector per input text, in input order, and must be
 * safe for concurrent use. Failures are reported as runtime exceptions; {@link
 * TransientEmbeddingFailurePredicate} decides which of them are worth retrying.
 */
public interface Embedder {

  /** Registry type name. */
  String type();

  /** Length of every vector this embedder produces. */
  int dimension();

  /** Maximum number of texts sent to the backend in one call. */
  int batchSize();

  List<float[]> embed(List<String> texts);
}

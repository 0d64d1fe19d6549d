package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.service.rag.store.ScoredRecord;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Plain vector similarity search; the score is the cosine similarity to the query. */
@Slf4j
public class SemanticRetrieval implements RetrievalStrategy {

  public static final String TYPE = "BasicSimilarityStrategy";

  private final String name;

  public SemanticRetrieval(String name) {
    this.name = name;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<RetrievedChunk> retrieve(RetrievalRequest request, RetrievalContext context) {
    float[] queryVector = context.embedder().embedQuery(request.query());
    List<ScoredRecord> hits =
        context.store().query(queryVector, request.topK(), request.filter());
    log.debug("{} returned {} results from {}", name, hits.size(), context.databaseName());
    return hits.stream().map(RetrievedChunk::from).toList();
  }
}

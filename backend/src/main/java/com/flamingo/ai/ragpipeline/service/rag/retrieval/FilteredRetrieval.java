package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import com.flamingo.ai.ragpipeline.service.rag.store.MetadataFilter;
import com.flamingo.ai.ragpipeline.service.rag.store.MetadataFilters;
import com.flamingo.ai.ragpipeline.service.rag.store.ScoredRecord;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Vector search restricted to chunks matching a configured filter, combined with the request's
 * own filter. With a {@code fallback-multiplier} above one the store is asked for more
 * candidates and the filter is re-checked in memory before the top k are kept.
 */
@Slf4j
public class FilteredRetrieval implements RetrievalStrategy {

  public static final String TYPE = "MetadataFilteredStrategy";

  private final String name;
  private final MetadataFilter configuredFilter;
  private final int fallbackMultiplier;

  public FilteredRetrieval(String name, MetadataFilter configuredFilter, int fallbackMultiplier) {
    this.name = name;
    this.configuredFilter = configuredFilter == null ? MetadataFilters.none() : configuredFilter;
    this.fallbackMultiplier = Math.max(1, fallbackMultiplier);
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
    MetadataFilter filter = MetadataFilters.and(configuredFilter, request.filter());
    float[] queryVector = context.embedder().embedQuery(request.query());
    List<ScoredRecord> hits =
        context.store().query(queryVector, request.topK() * fallbackMultiplier, filter);
    List<RetrievedChunk> results =
        hits.stream()
            .filter(hit -> filter.matches(hit.record().metadata()))
            .limit(request.topK())
            .map(RetrievedChunk::from)
            .toList();
    if (results.isEmpty()) {
      log.debug("{}: no chunks in {} match {}", name, context.databaseName(), filter);
    }
    return results;
  }
}

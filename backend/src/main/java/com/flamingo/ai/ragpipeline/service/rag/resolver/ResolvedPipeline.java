package com.flamingo.ai.ragpipeline.service.rag.resolver;

import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingExecutor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ExtractorPipeline;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ConfiguredParser;
import com.flamingo.ai.ragpipeline.service.rag.routing.DirectoryRoute;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;
import java.util.List;

/**
 * Everything the write path needs to ingest files of one processing strategy into one database.
 *
 * @param strategyName processing strategy name
 * @param parsers configured parsers in declaration order
 * @param directoryRules directory routing rules in declaration order
 * @param extractors metadata extractor pipeline
 * @param database the target database
 */
public record ResolvedPipeline(
    String strategyName,
    List<ConfiguredParser> parsers,
    List<DirectoryRoute> directoryRules,
    ExtractorPipeline extractors,
    ResolvedDatabase database) {

  public ResolvedPipeline {
    parsers = List.copyOf(parsers);
    directoryRules = List.copyOf(directoryRules);
  }

  public String databaseName() {
    return database.name();
  }

  public EmbeddingExecutor embedder() {
    return database.embedder();
  }

  public VectorStore store() {
    return database.store();
  }
}

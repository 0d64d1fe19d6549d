package com.flamingo.ai.ragpipeline.service.query;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.exception.BackendUnavailableException;
import com.flamingo.ai.ragpipeline.exception.EmbeddingException;
import com.flamingo.ai.ragpipeline.exception.StoreException;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedDatabase;
import com.flamingo.ai.ragpipeline.service.rag.resolver.StrategyResolver;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalRequest;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievalStrategy;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievedChunk;
import com.flamingo.ai.ragpipeline.service.rag.store.MetadataFilters;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs retrieval queries against configured databases.
 *
 * <p>An empty result is a normal answer. A store or embedder that cannot be reached surfaces as
 * {@link BackendUnavailableException} so callers can tell "no results" from "no backend".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryService {

  private final StrategyResolver strategyResolver;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.query", description = "Time to answer a retrieval query")
  public QueryResult query(String databaseName, QueryCommand command) {
    ResolvedDatabase database = strategyResolver.resolveDatabase(databaseName);
    RetrievalStrategy strategy = database.strategy(command.retrievalStrategy());
    RetrievalRequest request =
        new RetrievalRequest(
            command.query(), topK(command.topK()), MetadataFilters.fromMap(command.filters()));

    List<RetrievedChunk> results;
    try {
      results = strategy.retrieve(request, database.context());
    } catch (StoreException e) {
      meterRegistry.counter("rag.query.unavailable", "database", databaseName).increment();
      throw new BackendUnavailableException(
          databaseName, "Vector store of database '" + databaseName + "' is unavailable", e);
    } catch (EmbeddingException e) {
      if (!e.isTransientFailure()) {
        throw e;
      }
      meterRegistry.counter("rag.query.unavailable", "database", databaseName).increment();
      throw new BackendUnavailableException(
          databaseName, "Embedder of database '" + databaseName + "' is unavailable", e);
    }

    if (command.scoreThreshold() != null) {
      double threshold = command.scoreThreshold();
      results = results.stream().filter(result -> result.score() >= threshold).toList();
    }

    meterRegistry
        .counter("rag.query.count", "database", databaseName, "strategy", strategy.name())
        .increment();
    if (results.isEmpty()) {
      meterRegistry.counter("rag.query.empty", "database", databaseName).increment();
    }
    log.debug(
        "Query on '{}' with strategy '{}' returned {} result(s)",
        databaseName,
        strategy.name(),
        results.size());
    return new QueryResult(databaseName, strategy.name(), results);
  }

  private int topK(Integer requested) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    if (requested == null) {
      return retrieval.getDefaultTopK();
    }
    if (requested <= 0) {
      throw new IllegalArgumentException("topK must be positive");
    }
    return Math.min(requested, retrieval.getMaxTopK());
  }
}

package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedDatabase;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing a configured database. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseResponse {

  private String name;
  private String storeType;
  private String embedderType;
  private List<Strategy> retrievalStrategies;
  private String defaultRetrievalStrategy;

  /** A configured retrieval strategy. */
  @Data
  @AllArgsConstructor
  @NoArgsConstructor
  public static class Strategy {
    private String name;
    private String type;
  }

  /** Describes a database from configuration without instantiating its components. */
  public static DatabaseResponse fromConfig(RagConfig.Database database) {
    return DatabaseResponse.builder()
        .name(database.getName())
        .storeType(database.getStore().getType())
        .embedderType(database.getEmbeddingStrategy().getType())
        .retrievalStrategies(
            database.getRetrievalStrategies().stream()
                .map(strategy -> new Strategy(strategy.getName(), strategy.getType()))
                .toList())
        .defaultRetrievalStrategy(database.getDefaultRetrievalStrategy())
        .build();
  }

  /** Describes a resolved database, including implicit strategies and the derived default. */
  public static DatabaseResponse fromResolved(ResolvedDatabase database) {
    return DatabaseResponse.builder()
        .name(database.name())
        .storeType(database.store().type())
        .embedderType(database.embedder().getEmbedder().type())
        .retrievalStrategies(
            database.strategies().values().stream()
                .map(strategy -> new Strategy(strategy.name(), strategy.type()))
                .toList())
        .defaultRetrievalStrategy(database.defaultStrategy())
        .build();
  }
}

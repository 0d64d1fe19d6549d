package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.query.QueryResult;
import com.flamingo.ai.ragpipeline.service.rag.retrieval.RetrievedChunk;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a retrieval query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResultResponse {

  private String database;
  private String retrievalStrategy;
  private List<Hit> results;

  /** One ranked chunk. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Hit {
    private String id;
    private String text;
    private Map<String, Object> metadata;
    private double score;

    public static Hit from(RetrievedChunk chunk) {
      return Hit.builder()
          .id(chunk.id())
          .text(chunk.text())
          .metadata(chunk.metadata())
          .score(chunk.score())
          .build();
    }
  }

  public static QueryResultResponse from(QueryResult result) {
    return QueryResultResponse.builder()
        .database(result.databaseName())
        .retrievalStrategy(result.retrievalStrategy())
        .results(result.results().stream().map(Hit::from).toList())
        .build();
  }
}

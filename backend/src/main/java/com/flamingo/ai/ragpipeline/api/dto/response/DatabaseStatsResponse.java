package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.database.DatabaseStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO with the counts of a database. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseStatsResponse {

  private String database;
  private String storeType;
  private long vectorCount;
  private long documentCount;
  private long chunkCount;
  private int embeddingDimension;
  private String distanceMetric;

  public static DatabaseStatsResponse from(DatabaseStats stats) {
    return DatabaseStatsResponse.builder()
        .database(stats.database())
        .storeType(stats.storeType())
        .vectorCount(stats.vectorCount())
        .documentCount(stats.documentCount())
        .chunkCount(stats.chunkCount())
        .embeddingDimension(stats.embeddingDimension())
        .distanceMetric(stats.distanceMetric())
        .build();
  }
}

package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.domain.entity.Dataset;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for dataset data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetResponse {

  private UUID id;
  private String name;
  private String description;
  private String processingStrategy;
  private String database;
  private LocalDateTime createdAt;

  public static DatasetResponse fromEntity(Dataset dataset) {
    return DatasetResponse.builder()
        .id(dataset.getId())
        .name(dataset.getName())
        .description(dataset.getDescription())
        .processingStrategy(dataset.getProcessingStrategy())
        .database(dataset.getDatabaseName())
        .createdAt(dataset.getCreatedAt())
        .build();
  }
}

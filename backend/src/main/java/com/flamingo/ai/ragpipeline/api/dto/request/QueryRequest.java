package com.flamingo.ai.ragpipeline.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a retrieval query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Query is required")
  private String query;

  /** Retrieval strategy name; the database default when absent. */
  private String retrievalStrategy;

  @Min(value = 1, message = "topK must be at least 1")
  private Integer topK;

  /** Metadata filters, e.g. {@code {"page": {"gte": 3}, "parser": "PdfParser"}}. */
  private Map<String, Object> filters;

  private Double scoreThreshold;
}

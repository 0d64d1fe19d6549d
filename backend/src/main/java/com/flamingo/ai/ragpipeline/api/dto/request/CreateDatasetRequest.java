package com.flamingo.ai.ragpipeline.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a dataset. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDatasetRequest {

  @NotBlank(message = "Name is required")
  @Size(max = 100, message = "Name must be at most 100 characters")
  @Pattern(
      regexp = "[A-Za-z0-9][A-Za-z0-9_.-]*",
      message = "Name may contain letters, digits, '.', '_' and '-'")
  private String name;

  @Size(max = 2000, message = "Description must be at most 2000 characters")
  private String description;

  @NotBlank(message = "Processing strategy is required")
  private String processingStrategy;

  @NotBlank(message = "Database is required")
  private String database;
}

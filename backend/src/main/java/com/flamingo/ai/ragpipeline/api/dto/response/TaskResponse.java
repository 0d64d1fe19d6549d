package com.flamingo.ai.ragpipeline.api.dto.response;

import com.flamingo.ai.ragpipeline.service.ingestion.FileOutcome;
import com.flamingo.ai.ragpipeline.service.ingestion.FileStatus;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTask;
import com.flamingo.ai.ragpipeline.service.ingestion.TaskState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the status of an ingestion task. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

  private String taskId;
  private String dataset;
  private String processingStrategy;
  private String database;
  private TaskState state;
  private int totalFiles;
  private Map<FileStatus, Integer> counts;
  private List<FileOutcome> outcomes;
  private String error;
  private boolean cancelRequested;
  private Instant submittedAt;
  private Instant startedAt;
  private Instant finishedAt;

  public static TaskResponse from(IngestionTask task) {
    return TaskResponse.builder()
        .taskId(task.getId())
        .dataset(task.getJob().datasetName())
        .processingStrategy(task.getJob().strategyName())
        .database(task.getJob().databaseName())
        .state(task.getState())
        .totalFiles(task.getTotalFiles())
        .counts(task.getCounts())
        .outcomes(task.getOutcomes())
        .error(task.getError())
        .cancelRequested(task.isCancelRequested())
        .submittedAt(task.getSubmittedAt())
        .startedAt(task.getStartedAt())
        .finishedAt(task.getFinishedAt())
        .build();
  }
}

package com.flamingo.ai.ragpipeline.exception;

import java.util.List;

/** Exception thrown when a dataset cannot be changed while ingestion tasks are running on it. */
public class DatasetBusyException extends RuntimeException {

  private final String datasetName;
  private final List<String> taskIds;

  public DatasetBusyException(String datasetName, List<String> taskIds) {
    super("Dataset '" + datasetName + "' has running ingestion tasks: " + taskIds);
    this.datasetName = datasetName;
    this.taskIds = List.copyOf(taskIds);
  }

  public String getDatasetName() {
    return datasetName;
  }

  public List<String> getTaskIds() {
    return taskIds;
  }
}

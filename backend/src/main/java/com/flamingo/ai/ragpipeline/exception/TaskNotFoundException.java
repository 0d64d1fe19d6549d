package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when an ingestion task id is unknown or has been evicted. */
public class TaskNotFoundException extends RuntimeException {

  private final String taskId;

  public TaskNotFoundException(String taskId) {
    super("Ingestion task not found: " + taskId);
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}

package com.flamingo.ai.ragpipeline.service.ingestion;

/** Lifecycle state of an ingestion task. */
public enum TaskState {
  PENDING,
  RUNNING,
  /** No file failed and none was unsupported. */
  SUCCEEDED,
  /** Files were submitted and none of them was stored. */
  FAILED,
  /** Some files were stored, others failed or were unsupported. */
  PARTIAL,
  /** Cancelled before every file started. */
  CANCELLED;

  public boolean isTerminal() {
    return this != PENDING && this != RUNNING;
  }
}

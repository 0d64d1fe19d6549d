package com.flamingo.ai.ragpipeline.service.ingestion;

/** Outcome status of one file in an ingestion task. */
public enum FileStatus {
  PROCESSED,
  FAILED,
  SKIPPED_DUPLICATE,
  SKIPPED_UNSUPPORTED,
  CANCELLED;

  /** Whether the file is stored in the database after the task. */
  public boolean isStored() {
    return this == PROCESSED || this == SKIPPED_DUPLICATE;
  }
}

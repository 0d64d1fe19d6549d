package com.flamingo.ai.ragpipeline.domain.enums;

/** Ingestion status of an uploaded dataset document. */
public enum DocumentStatus {
  /** Uploaded, not yet ingested. */
  PENDING,

  /** Picked up by a running ingestion task. */
  PROCESSING,

  /** Chunks are stored in the dataset's database. */
  INGESTED,

  /** The last ingestion attempt failed or found no parser for the file. */
  FAILED
}

package com.flamingo.ai.ragpipeline.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DATASET_NOT_FOUND = "DATASET_001";
  public static final String DATASET_ALREADY_EXISTS = "DATASET_002";
  public static final String DATASET_BUSY = "DATASET_003";
  public static final String DATABASE_NOT_FOUND = "DATABASE_001";
  public static final String DOCUMENT_NOT_FOUND = "DATABASE_002";
  public static final String TASK_NOT_FOUND = "TASK_001";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String EMBEDDING_ERROR = "EMBEDDING_002";
  public static final String STORE_ERROR = "STORE_001";
  public static final String BACKEND_UNAVAILABLE = "STORE_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}

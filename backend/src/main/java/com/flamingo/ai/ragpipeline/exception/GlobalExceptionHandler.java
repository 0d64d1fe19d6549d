package com.flamingo.ai.ragpipeline.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DatasetNotFoundException.class)
  public ResponseEntity<ApiError> handleDatasetNotFound(
      DatasetNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("dataset_not_found");
    String errorId = generateErrorId();
    log.warn("Dataset not found [{}]: {}", errorId, ex.getDatasetName());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DATASET_NOT_FOUND)
                .message("Dataset not found: " + ex.getDatasetName())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DatasetAlreadyExistsException.class)
  public ResponseEntity<ApiError> handleDatasetExists(
      DatasetAlreadyExistsException ex, HttpServletRequest request) {

    incrementErrorCounter("dataset_already_exists");
    String errorId = generateErrorId();
    log.warn("Dataset already exists [{}]: {}", errorId, ex.getDatasetName());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DATASET_ALREADY_EXISTS)
                .message("Dataset already exists: " + ex.getDatasetName())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DatasetBusyException.class)
  public ResponseEntity<ApiError> handleDatasetBusy(
      DatasetBusyException ex, HttpServletRequest request) {

    incrementErrorCounter("dataset_busy");
    String errorId = generateErrorId();
    log.warn("Dataset busy [{}]: {} tasks {}", errorId, ex.getDatasetName(), ex.getTaskIds());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DATASET_BUSY)
                .message(
                    "Dataset has running ingestion tasks, cancellation was requested; "
                        + "retry when they finish")
                .details(String.join(",", ex.getTaskIds()))
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn(
        "Document not found [{}]: {} in {}", errorId, ex.getDocumentHash(), ex.getDatabaseName());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_NOT_FOUND)
                .message("Document not found: " + ex.getDocumentHash())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DatabaseNotFoundException.class)
  public ResponseEntity<ApiError> handleDatabaseNotFound(
      DatabaseNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("database_not_found");
    String errorId = generateErrorId();
    log.warn("Database not found [{}]: {}", errorId, ex.getDatabaseName());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DATABASE_NOT_FOUND)
                .message("Database not found: " + ex.getDatabaseName())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<ApiError> handleTaskNotFound(
      TaskNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("task_not_found");
    String errorId = generateErrorId();
    log.warn("Task not found [{}]: {}", errorId, ex.getTaskId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.TASK_NOT_FOUND)
                .message("Ingestion task not found")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration_error");
    String errorId = generateErrorId();
    log.error("Configuration error [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.CONFIGURATION_ERROR)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<ApiError> handleBackendUnavailable(
      BackendUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("backend_unavailable");
    String errorId = generateErrorId();
    log.error("Backend unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.BACKEND_UNAVAILABLE)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(EmbeddingException.class)
  public ResponseEntity<ApiError> handleEmbedding(
      EmbeddingException ex, HttpServletRequest request) {

    String errorType = ex.isTransientFailure() ? "embedding_unavailable" : "embedding_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("Embedding error [{}]: {}", errorId, ex.getMessage(), ex);

    HttpStatus status =
        ex.isTransientFailure() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_REQUEST;
    String code =
        ex.isTransientFailure() ? ApiError.EMBEDDING_UNAVAILABLE : ApiError.EMBEDDING_ERROR;

    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ApiError> handleStore(StoreException ex, HttpServletRequest request) {

    incrementErrorCounter("store_error");
    String errorId = generateErrorId();
    log.error("Store error [{}] in {}: {}", errorId, ex.getStoreName(), ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.STORE_ERROR)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}

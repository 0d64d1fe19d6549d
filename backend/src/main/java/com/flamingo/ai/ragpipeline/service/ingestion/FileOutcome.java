package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.service.rag.extraction.ExtractionError;
import java.util.List;

/**
 * What happened to one submitted file.
 *
 * @param fileName relative path as uploaded
 * @param contentHash SHA-256 of the file bytes
 * @param status outcome status
 * @param parser name of the parser that produced the chunks, null if none did
 * @param totalChunks chunks produced by the parser
 * @param storedChunks chunks written to the store
 * @param failedChunks chunks dropped because their embedding failed
 * @param extractionErrors metadata extractor failures, the chunks were still stored
 * @param error failure or skip reason, null on success
 */
public record FileOutcome(
    String fileName,
    String contentHash,
    FileStatus status,
    String parser,
    int totalChunks,
    int storedChunks,
    int failedChunks,
    List<ExtractionError> extractionErrors,
    String error) {

  public FileOutcome {
    extractionErrors = extractionErrors == null ? List.of() : List.copyOf(extractionErrors);
  }

  public static FileOutcome processed(
      IngestionFile file,
      String parser,
      int totalChunks,
      int storedChunks,
      List<ExtractionError> extractionErrors) {
    return new FileOutcome(
        file.fileName(),
        file.contentHash(),
        FileStatus.PROCESSED,
        parser,
        totalChunks,
        storedChunks,
        totalChunks - storedChunks,
        extractionErrors,
        null);
  }

  public static FileOutcome duplicate(IngestionFile file) {
    return skipped(file, FileStatus.SKIPPED_DUPLICATE, "Document already stored in database");
  }

  public static FileOutcome unsupported(IngestionFile file, String reason) {
    return skipped(file, FileStatus.SKIPPED_UNSUPPORTED, reason);
  }

  public static FileOutcome cancelled(IngestionFile file) {
    return skipped(file, FileStatus.CANCELLED, "Task was cancelled before the file started");
  }

  public static FileOutcome failed(IngestionFile file, String parser, String error) {
    return new FileOutcome(
        file.fileName(), file.contentHash(), FileStatus.FAILED, parser, 0, 0, 0, List.of(), error);
  }

  private static FileOutcome skipped(IngestionFile file, FileStatus status, String reason) {
    return new FileOutcome(
        file.fileName(), file.contentHash(), status, null, 0, 0, 0, List.of(), reason);
  }
}

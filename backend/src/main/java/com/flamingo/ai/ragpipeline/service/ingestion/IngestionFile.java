package com.flamingo.ai.ragpipeline.service.ingestion;

import java.nio.file.Path;
import java.util.UUID;

/**
 * A stored file submitted for ingestion.
 *
 * @param fileName relative path as uploaded
 * @param contentHash SHA-256 of the file bytes
 * @param path location of the raw bytes
 * @param mimeType MIME type reported at upload, may be null
 * @param sizeBytes file size
 * @param documentId dataset document row to update, null when the file is not tracked
 */
public record IngestionFile(
    String fileName,
    String contentHash,
    Path path,
    String mimeType,
    long sizeBytes,
    UUID documentId) {}

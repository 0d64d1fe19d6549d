package com.flamingo.ai.ragpipeline.service.dataset;

/**
 * Result of uploading one file to a dataset.
 *
 * @param fileName relative path as stored
 * @param contentHash SHA-256 of the bytes
 * @param processed whether the content is already ingested in the dataset
 * @param skipped whether the dataset already contained the same content
 */
public record UploadResult(
    String fileName, String contentHash, boolean processed, boolean skipped) {}

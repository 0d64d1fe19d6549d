package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when no parser of a processing strategy accepts a file. */
public class FormatUnsupportedException extends RuntimeException {

  private final String fileName;
  private final String detectedMimeType;

  public FormatUnsupportedException(String fileName, String detectedMimeType) {
    super("No parser available for " + fileName + " (detected " + detectedMimeType + ")");
    this.fileName = fileName;
    this.detectedMimeType = detectedMimeType;
  }

  public String getFileName() {
    return fileName;
  }

  public String getDetectedMimeType() {
    return detectedMimeType;
  }
}

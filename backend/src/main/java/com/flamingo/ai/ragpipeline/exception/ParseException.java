package com.flamingo.ai.ragpipeline.exception;

import java.util.List;

/** Exception thrown when every parser in a fallback chain failed for a file. */
public class ParseException extends RuntimeException {

  private final String fileName;
  private final List<String> attemptedParsers;

  public ParseException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
    this.attemptedParsers = List.of();
  }

  public ParseException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.attemptedParsers = List.of();
  }

  public ParseException(
      String fileName, List<String> attemptedParsers, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.attemptedParsers = List.copyOf(attemptedParsers);
  }

  public String getFileName() {
    return fileName;
  }

  public List<String> getAttemptedParsers() {
    return attemptedParsers;
  }
}

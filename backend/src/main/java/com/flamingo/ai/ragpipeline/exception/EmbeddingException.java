package com.flamingo.ai.ragpipeline.exception;

/**
 * Exception thrown when an embedding backend fails.
 *
 * <p>Transient failures (backend unreachable, timeouts, rate limits) are retried with backoff;
 * permanent failures (malformed input) fail only the affected chunks.
 */
public class EmbeddingException extends RuntimeException {

  private final boolean transientFailure;
  private final String userMessage;

  public EmbeddingException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
    this.userMessage = defaultUserMessage(transientFailure);
  }

  public EmbeddingException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
    this.userMessage = defaultUserMessage(transientFailure);
  }

  public static EmbeddingException transientFailure(String message, Throwable cause) {
    return new EmbeddingException(message, true, cause);
  }

  public static EmbeddingException permanentFailure(String message, Throwable cause) {
    return new EmbeddingException(message, false, cause);
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static String defaultUserMessage(boolean transientFailure) {
    return transientFailure
        ? "Embedding service is temporarily unavailable. Please try again later."
        : "Content could not be embedded";
  }
}

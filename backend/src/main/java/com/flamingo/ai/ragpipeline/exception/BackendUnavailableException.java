package com.flamingo.ai.ragpipeline.exception;

/**
 * Exception thrown when a query cannot be served because the store or embedding backend of a
 * database is not reachable. Distinct from an empty result, which is a successful query.
 */
public class BackendUnavailableException extends RuntimeException {

  private final String databaseName;
  private final String userMessage;

  public BackendUnavailableException(String databaseName, String message, Throwable cause) {
    super(message, cause);
    this.databaseName = databaseName;
    this.userMessage =
        "Retrieval backend for database '" + databaseName + "' is currently unavailable";
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

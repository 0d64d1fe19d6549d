package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when a database name is not declared in the configuration. */
public class DatabaseNotFoundException extends RuntimeException {

  private final String databaseName;

  public DatabaseNotFoundException(String databaseName) {
    super("Database not found: " + databaseName);
    this.databaseName = databaseName;
  }

  public String getDatabaseName() {
    return databaseName;
  }
}

package com.flamingo.ai.ragpipeline.exception;

/**
 * Exception thrown when the declarative pipeline configuration is invalid: unknown component
 * types, incompatible chunk sizing, or an embedding dimensionality that does not match the target
 * database.
 */
public class ConfigurationException extends RuntimeException {

  private final String userMessage;

  public ConfigurationException(String message) {
    super(message);
    this.userMessage = message;
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

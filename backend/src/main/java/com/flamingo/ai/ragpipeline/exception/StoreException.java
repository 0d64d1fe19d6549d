package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when the backing vector store rejects a write or a query. */
public class StoreException extends RuntimeException {

  private final String storeName;
  private final String userMessage;

  public StoreException(String storeName, String message) {
    super(message);
    this.storeName = storeName;
    this.userMessage = "Vector store operation failed";
  }

  public StoreException(String storeName, String message, Throwable cause) {
    super(message, cause);
    this.storeName = storeName;
    this.userMessage = "Vector store operation failed";
  }

  public String getStoreName() {
    return storeName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

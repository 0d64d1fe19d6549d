package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when a database holds no document with the given content hash. */
public class DocumentNotFoundException extends RuntimeException {

  private final String databaseName;
  private final String documentHash;

  public DocumentNotFoundException(String databaseName, String documentHash) {
    super("Document " + documentHash + " not found in database " + databaseName);
    this.databaseName = databaseName;
    this.documentHash = documentHash;
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public String getDocumentHash() {
    return documentHash;
  }
}

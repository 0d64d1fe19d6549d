package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when creating a dataset whose name is taken. */
public class DatasetAlreadyExistsException extends RuntimeException {

  private final String datasetName;

  public DatasetAlreadyExistsException(String datasetName) {
    super("Dataset already exists: " + datasetName);
    this.datasetName = datasetName;
  }

  public String getDatasetName() {
    return datasetName;
  }
}

package com.flamingo.ai.ragpipeline.exception;

/** Exception thrown when a dataset is not found. */
public class DatasetNotFoundException extends RuntimeException {

  private final String datasetName;

  public DatasetNotFoundException(String datasetName) {
    super("Dataset not found: " + datasetName);
    this.datasetName = datasetName;
  }

  public String getDatasetName() {
    return datasetName;
  }
}

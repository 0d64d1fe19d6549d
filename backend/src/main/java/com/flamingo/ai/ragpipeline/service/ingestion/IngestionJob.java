package com.flamingo.ai.ragpipeline.service.ingestion;

import java.util.List;

/**
 * A batch of files to ingest with one processing strategy into one database.
 *
 * @param datasetName dataset the files belong to
 * @param strategyName data processing strategy
 * @param databaseName target database
 * @param files files in submission order
 */
public record IngestionJob(
    String datasetName, String strategyName, String databaseName, List<IngestionFile> files) {

  public IngestionJob {
    files = List.copyOf(files);
  }
}

package com.flamingo.ai.ragpipeline.service.database;

import java.util.List;

/**
 * A document stored in a database, joined with the datasets that reference it.
 *
 * @param id content hash of the document
 * @param filename name the content was first ingested under
 * @param chunkCount stored chunks
 * @param sizeBytes size of the source file, 0 when no dataset row records it
 * @param parserUsed parser that produced the chunks
 * @param dateIngested ISO-8601 instant of ingestion
 * @param datasets names of the datasets of this database that hold the content, sorted
 */
public record DocumentSummary(
    String id,
    String filename,
    int chunkCount,
    long sizeBytes,
    String parserUsed,
    String dateIngested,
    List<String> datasets) {

  public DocumentSummary {
    datasets = List.copyOf(datasets);
  }
}

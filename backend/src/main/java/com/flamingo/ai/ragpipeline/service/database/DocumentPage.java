package com.flamingo.ai.ragpipeline.service.database;

import java.util.List;

/** One page of the documents of a database, ordered by file name. */
public record DocumentPage(
    String database, List<DocumentSummary> documents, int totalCount, int limit, int offset) {

  public DocumentPage {
    documents = List.copyOf(documents);
  }
}

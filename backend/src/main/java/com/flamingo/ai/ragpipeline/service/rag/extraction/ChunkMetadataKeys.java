package com.flamingo.ai.ragpipeline.service.rag.extraction;

import java.util.Set;

/** Metadata keys written by the ingestion engine itself. Extractors cannot overwrite them. */
public final class ChunkMetadataKeys {

  public static final String DOCUMENT_HASH = "document_hash";
  public static final String CHUNK_INDEX = "chunk_index";
  public static final String TOTAL_CHUNKS = "total_chunks";
  public static final String CHUNK_HASH = "chunk_hash";
  public static final String FILENAME = "filename";
  public static final String PARSER = "parser";
  /**
   * Dataset whose ingestion stored the content. Content shared by several datasets is stored once,
   * so later datasets appear only in the dataset rows that reference it.
   */
  public static final String DATASET = "dataset";
  public static final String INGESTED_AT = "ingested_at";

  public static final Set<String> RESERVED =
      Set.of(
          DOCUMENT_HASH, CHUNK_INDEX, TOTAL_CHUNKS, CHUNK_HASH, FILENAME, PARSER, DATASET,
          INGESTED_AT);

  private ChunkMetadataKeys() {}

  public static boolean isReserved(String key) {
    return RESERVED.contains(key);
  }
}

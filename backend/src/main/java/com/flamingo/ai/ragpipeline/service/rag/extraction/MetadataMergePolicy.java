package com.flamingo.ai.ragpipeline.service.rag.extraction;

/** How an extractor's output is merged into metadata already present on a chunk. */
public enum MetadataMergePolicy {
  /** Later extractors overwrite earlier values. */
  LAST_WRITE_WINS,
  /** The first value written for a key is kept. */
  KEEP_FIRST,
  /** Differing values for an existing key are reported as errors; the earlier value is kept. */
  REJECT_CONFLICTS
}

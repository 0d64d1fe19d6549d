package com.flamingo.ai.ragpipeline.service.rag.store;

/** Outcome of an idempotent write. */
public enum UpsertResult {
  INSERTED,
  ALREADY_PRESENT,
  UPDATED
}

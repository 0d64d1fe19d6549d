package com.flamingo.ai.ragpipeline.service.rag.store;

import java.util.Collection;
import java.util.List;

/**
 * Persistent home of the chunks of one database.
 *
 * <p>Every write checks vector dimensions against {@link #dimension()} and rejects mismatches
 * with a {@code ConfigurationException}. Readers never observe a partially applied {@link
 * #upsertDocument}. Backend failures surface as {@code StoreException}.
 */
public interface VectorStore extends AutoCloseable {

  /** Registry type name. */
  String type();

  int dimension();

  /**
   * Writes a single record, idempotent by chunk content hash.
   *
   * @return {@link UpsertResult#ALREADY_PRESENT} if a record with the same id and chunk hash
   *     exists, {@link UpsertResult#UPDATED} if the id existed with different content
   */
  UpsertResult upsert(VectorRecord record);

  /**
   * Writes all chunks of a document unless the document is already stored. The check and the
   * write are one atomic step.
   *
   * @return {@link UpsertResult#INSERTED}, or {@link UpsertResult#ALREADY_PRESENT} with nothing
   *     written
   */
  UpsertResult upsertDocument(String documentHash, List<VectorRecord> records);

  /** Top-k records by cosine similarity among those matching the filter. */
  List<ScoredRecord> query(float[] vector, int topK, MetadataFilter filter);

  /** Top-k records by lexical relevance among those matching the filter. */
  List<ScoredRecord> lexicalQuery(String text, int topK, MetadataFilter filter);

  /** All chunks of a document ordered by chunk index. */
  List<VectorRecord> getDocumentChunks(String documentHash);

  boolean containsDocument(String documentHash);

  /** Every stored document, in no particular order. */
  List<StoredDocument> listDocuments();

  long documentCount();

  /** Removes every chunk of a document and returns how many were removed. */
  int deleteDocument(String documentHash);

  /** Removes records by id and returns how many existed. */
  int delete(Collection<String> ids);

  long count();

  @Override
  default void close() {}
}

package com.flamingo.ai.ragpipeline.service.rag.store;

import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.service.rag.TextAnalyzer;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ChunkMetadataKeys;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local {@link VectorStore} with exact brute-force search.
 *
 * <p>Reads share a read lock and writes take the write lock, so a document upsert becomes visible
 * all at once. Contents are lost on restart.
 */
@Slf4j
public class InMemoryStore implements VectorStore {

  public static final String TYPE = "InMemoryStore";

  static final Comparator<ScoredRecord> BY_SCORE =
      Comparator.comparingDouble(ScoredRecord::score)
          .reversed()
          .thenComparing(scored -> scored.record().id());

  private final String name;
  private final int dimension;
  private final Map<String, VectorRecord> records = new LinkedHashMap<>();
  private final Map<String, Set<String>> idsByDocument = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public InMemoryStore(String name, int dimension) {
    if (dimension <= 0) {
      throw new ConfigurationException(name + ": store dimension must be positive");
    }
    this.name = name;
    this.dimension = dimension;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public UpsertResult upsert(VectorRecord record) {
    checkDimension(record.vector());
    lock.writeLock().lock();
    try {
      return put(record);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public UpsertResult upsertDocument(String documentHash, List<VectorRecord> records) {
    records.forEach(record -> checkDimension(record.vector()));
    lock.writeLock().lock();
    try {
      if (idsByDocument.containsKey(documentHash)) {
        return UpsertResult.ALREADY_PRESENT;
      }
      records.forEach(this::put);
      idsByDocument.computeIfAbsent(documentHash, hash -> new LinkedHashSet<>());
      log.debug("{}: stored {} chunks of document {}", name, records.size(), documentHash);
      return UpsertResult.INSERTED;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private UpsertResult put(VectorRecord record) {
    VectorRecord existing = records.put(record.id(), record);
    idsByDocument
        .computeIfAbsent(record.documentHash(), hash -> new LinkedHashSet<>())
        .add(record.id());
    if (existing == null) {
      return UpsertResult.INSERTED;
    }
    if (existing.chunkHash().equals(record.chunkHash())) {
      return UpsertResult.ALREADY_PRESENT;
    }
    if (!existing.documentHash().equals(record.documentHash())) {
      Set<String> previous = idsByDocument.get(existing.documentHash());
      if (previous != null) {
        previous.remove(record.id());
      }
    }
    return UpsertResult.UPDATED;
  }

  @Override
  public List<ScoredRecord> query(float[] vector, int topK, MetadataFilter filter) {
    checkDimension(vector);
    Embedding queryEmbedding = Embedding.from(vector);
    lock.readLock().lock();
    try {
      List<ScoredRecord> scored = new ArrayList<>();
      for (VectorRecord record : records.values()) {
        if (filter == null || filter.matches(record.metadata())) {
          double score = CosineSimilarity.between(queryEmbedding, Embedding.from(record.vector()));
          scored.add(new ScoredRecord(record, score));
        }
      }
      return top(scored, topK);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<ScoredRecord> lexicalQuery(String text, int topK, MetadataFilter filter) {
    Set<String> queryTerms = TextAnalyzer.terms(text);
    if (queryTerms.isEmpty()) {
      return List.of();
    }
    lock.readLock().lock();
    try {
      List<ScoredRecord> scored = new ArrayList<>();
      for (VectorRecord record : records.values()) {
        if (filter != null && !filter.matches(record.metadata())) {
          continue;
        }
        double score = TextAnalyzer.termOverlap(queryTerms, record.text());
        if (score > 0) {
          scored.add(new ScoredRecord(record, score));
        }
      }
      return top(scored, topK);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<VectorRecord> getDocumentChunks(String documentHash) {
    lock.readLock().lock();
    try {
      Set<String> ids = idsByDocument.getOrDefault(documentHash, Set.of());
      return ids.stream()
          .map(records::get)
          .sorted(Comparator.comparingInt(VectorRecord::chunkIndex))
          .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public boolean containsDocument(String documentHash) {
    lock.readLock().lock();
    try {
      return idsByDocument.containsKey(documentHash);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<StoredDocument> listDocuments() {
    lock.readLock().lock();
    try {
      List<StoredDocument> documents = new ArrayList<>(idsByDocument.size());
      idsByDocument.forEach(
          (hash, ids) -> {
            Map<String, Object> metadata =
                ids.stream()
                    .map(records::get)
                    .min(Comparator.comparingInt(VectorRecord::chunkIndex))
                    .map(VectorRecord::metadata)
                    .orElse(Map.of());
            documents.add(
                new StoredDocument(
                    hash,
                    stringValue(metadata, ChunkMetadataKeys.FILENAME),
                    stringValue(metadata, ChunkMetadataKeys.PARSER),
                    stringValue(metadata, ChunkMetadataKeys.INGESTED_AT),
                    ids.size()));
          });
      return documents;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long documentCount() {
    lock.readLock().lock();
    try {
      return idsByDocument.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private static String stringValue(Map<String, Object> metadata, String key) {
    Object value = metadata.get(key);
    return value == null ? null : value.toString();
  }

  @Override
  public int deleteDocument(String documentHash) {
    lock.writeLock().lock();
    try {
      Set<String> ids = idsByDocument.remove(documentHash);
      if (ids == null) {
        return 0;
      }
      ids.forEach(records::remove);
      log.debug("{}: deleted {} chunks of document {}", name, ids.size(), documentHash);
      return ids.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public int delete(Collection<String> ids) {
    lock.writeLock().lock();
    try {
      int removed = 0;
      for (String id : ids) {
        VectorRecord record = records.remove(id);
        if (record != null) {
          removed++;
          Set<String> documentIds = idsByDocument.get(record.documentHash());
          if (documentIds != null) {
            documentIds.remove(id);
            if (documentIds.isEmpty()) {
              idsByDocument.remove(record.documentHash());
            }
          }
        }
      }
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public long count() {
    lock.readLock().lock();
    try {
      return records.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private void checkDimension(float[] vector) {
    if (vector == null || vector.length != dimension) {
      throw new ConfigurationException(
          name
              + ": vector dimension "
              + (vector == null ? 0 : vector.length)
              + " does not match store dimension "
              + dimension);
    }
  }

  private static List<ScoredRecord> top(List<ScoredRecord> scored, int topK) {
    return scored.stream().sorted(BY_SCORE).limit(Math.max(0, topK)).toList();
  }
}

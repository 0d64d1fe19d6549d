package com.flamingo.ai.ragpipeline.service.rag.store;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicTemplate;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.util.NamedValue;
import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.StoreException;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ChunkMetadataKeys;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VectorStore} backed by an Elasticsearch index.
 *
 * <p>Chunks are stored with a {@code dense_vector} field (cosine similarity) for kNN search and an
 * analysed {@code text} field for BM25. Metadata is stored under {@code metadata.*} with strings
 * mapped as keywords so filters match exactly. Each stored document also gets a marker record
 * written with the {@code create} op type: the marker is the compare-and-set that makes
 * concurrent ingestion of the same content a no-op. Markers also carry the chunk count, file name,
 * parser and ingestion time that document listings read. Writes use {@code refresh=wait_for} so
 * they are searchable when the call returns.
 */
@Slf4j
public class ElasticsearchStore implements VectorStore {

  public static final String TYPE = "ElasticsearchStore";

  static final String RECORD_TYPE = "record_type";
  static final String CHUNK = "chunk";
  static final String DOCUMENT = "document";

  private static final int MAX_DOCUMENT_CHUNKS = 10_000;
  private static final int MAX_LISTED_DOCUMENTS = 10_000;
  private static final List<String> MARKER_KEYS =
      List.of(ChunkMetadataKeys.FILENAME, ChunkMetadataKeys.PARSER, ChunkMetadataKeys.INGESTED_AT);

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int dimension;

  public ElasticsearchStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int dimension) {
    if (dimension <= 0) {
      throw new ConfigurationException(indexName + ": store dimension must be positive");
    }
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
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

  public String getIndexName() {
    return indexName;
  }

  /** Creates the index, or verifies that an existing index has the expected vector dimension. */
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (!exists) {
        elasticsearchClient
            .indices()
            .create(
                c ->
                    c.index(indexName)
                        .mappings(
                            m ->
                                m.properties(defineIndexProperties())
                                    .dynamicTemplates(
                                        NamedValue.of(
                                            "metadata_strings",
                                            DynamicTemplate.of(
                                                d ->
                                                    d.pathMatch("metadata.*")
                                                        .matchMappingType("string")
                                                        .mapping(
                                                            Property.of(
                                                                p -> p.keyword(k -> k))))))));
        log.info("Created Elasticsearch index: {}", indexName);
        return;
      }
      validateVectorMapping();
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new StoreException(indexName, "Failed to initialize index '" + indexName + "'", e);
    }
  }

  private Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("id", Property.of(p -> p.keyword(k -> k)));
    properties.put("document_hash", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunk_hash", Property.of(p -> p.keyword(k -> k)));
    properties.put(RECORD_TYPE, Property.of(p -> p.keyword(k -> k)));
    properties.put("chunk_index", Property.of(p -> p.integer(i -> i)));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer("standard")))));
    properties.put("metadata", Property.of(p -> p.object(o -> o)));
    properties.put(
        "vector",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(dimension)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  private void validateVectorMapping() throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(indexName));
    var indexMapping = response.get(indexName);
    if (indexMapping == null) {
      return;
    }
    Property vector = indexMapping.mappings().properties().get("vector");
    if (vector != null && vector.isDenseVector()) {
      Integer dims = vector.denseVector().dims();
      if (dims != null && dims != dimension) {
        throw new ConfigurationException(
            "Index '"
                + indexName
                + "' stores vectors of dimension "
                + dims
                + " but the database is configured for "
                + dimension);
      }
    }
    log.debug("Index '{}' mapping verified", indexName);
  }

  @Override
  public UpsertResult upsert(VectorRecord record) {
    checkDimension(record.vector());
    try {
      GetResponse<Map> existing =
          elasticsearchClient.get(g -> g.index(indexName).id(record.id()), Map.class);
      if (existing.found()
          && existing.source() != null
          && record.chunkHash().equals(existing.source().get("chunk_hash"))) {
        return UpsertResult.ALREADY_PRESENT;
      }
      elasticsearchClient.index(
          i ->
              i.index(indexName)
                  .id(record.id())
                  .document(toDocument(record))
                  .refresh(Refresh.WaitFor));
      meterRegistry.counter("vector_store.indexed", "store", TYPE).increment();
      return existing.found() ? UpsertResult.UPDATED : UpsertResult.INSERTED;
    } catch (IOException | ElasticsearchException e) {
      throw failure("upsert " + record.id(), e);
    }
  }

  @Override
  public UpsertResult upsertDocument(String documentHash, List<VectorRecord> records) {
    records.forEach(record -> checkDimension(record.vector()));
    Map<String, Object> marker = new HashMap<>();
    marker.put(RECORD_TYPE, DOCUMENT);
    marker.put("document_hash", documentHash);
    marker.put("chunk_count", records.size());
    if (!records.isEmpty()) {
      Map<String, Object> first = records.get(0).metadata();
      for (String key : MARKER_KEYS) {
        if (first.get(key) != null) {
          marker.put(key, first.get(key).toString());
        }
      }
    }
    try {
      elasticsearchClient.create(
          c -> c.index(indexName).id(markerId(documentHash)).document(marker));
    } catch (ElasticsearchException e) {
      if (e.status() == 409) {
        log.debug("Document {} already present in {}", documentHash, indexName);
        return UpsertResult.ALREADY_PRESENT;
      }
      throw failure("claim document " + documentHash, e);
    } catch (IOException e) {
      throw failure("claim document " + documentHash, e);
    }

    try {
      if (!records.isEmpty()) {
        BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
        for (VectorRecord record : records) {
          Map<String, Object> document = toDocument(record);
          bulkBuilder.operations(
              op -> op.index(idx -> idx.index(indexName).id(record.id()).document(document)));
        }
        BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
        if (response.errors()) {
          rollback(documentHash);
          throw new StoreException(
              indexName, "Bulk indexing of document " + documentHash + " reported errors");
        }
      }
      meterRegistry.counter("vector_store.indexed", "store", TYPE).increment(records.size());
      log.debug("Indexed {} chunks of document {} to {}", records.size(), documentHash, indexName);
      return UpsertResult.INSERTED;
    } catch (IOException | ElasticsearchException e) {
      rollback(documentHash);
      throw failure("index document " + documentHash, e);
    }
  }

  private void rollback(String documentHash) {
    try {
      deleteDocument(documentHash);
    } catch (StoreException e) {
      log.error("Rollback of document {} in {} failed", documentHash, indexName, e);
    }
  }

  @Override
  public List<ScoredRecord> query(float[] vector, int topK, MetadataFilter filter) {
    checkDimension(vector);
    if (topK <= 0) {
      return List.of();
    }
    List<Float> queryVector = new ArrayList<>(vector.length);
    for (float v : vector) {
      queryVector.add(v);
    }
    Query chunkFilter = chunkFilter(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("vector")
                                .queryVector(queryVector)
                                .k(topK)
                                .numCandidates(Math.min(10_000, Math.max(100, topK * 10)))
                                .filter(chunkFilter))
                    .size(topK));
    // Elasticsearch reports cosine kNN scores as (1 + cos) / 2
    return search(request, "vector_search", score -> 2 * score - 1);
  }

  @Override
  public List<ScoredRecord> lexicalQuery(String text, int topK, MetadataFilter filter) {
    if (text == null || text.isBlank() || topK <= 0) {
      return List.of();
    }
    Query chunkFilter = chunkFilter(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(chunkFilter)
                                        .must(m -> m.match(mt -> mt.field("text").query(text)))))
                    .size(topK));
    return search(request, "keyword_search", score -> score);
  }

  @Override
  @SuppressWarnings("unchecked")
  public List<VectorRecord> getDocumentChunks(String documentHash) {
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName)
                      .query(byChunksOf(documentHash))
                      .sort(so -> so.field(f -> f.field("chunk_index").order(SortOrder.Asc)))
                      .size(MAX_DOCUMENT_CHUNKS),
              Map.class);
      List<VectorRecord> records = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        if (hit.source() != null) {
          records.add(fromDocument(hit.id(), hit.source()));
        }
      }
      return records;
    } catch (IOException | ElasticsearchException e) {
      throw failure("read document " + documentHash, e);
    }
  }

  @Override
  public boolean containsDocument(String documentHash) {
    try {
      return elasticsearchClient
          .exists(e -> e.index(indexName).id(markerId(documentHash)))
          .value();
    } catch (IOException | ElasticsearchException e) {
      throw failure("check document " + documentHash, e);
    }
  }

  @Override
  public List<StoredDocument> listDocuments() {
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s -> s.index(indexName).query(isMarker()).size(MAX_LISTED_DOCUMENTS), Map.class);
      List<StoredDocument> documents = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<?, ?> source = hit.source();
        if (source != null) {
          Object chunkCount = source.get("chunk_count");
          documents.add(
              new StoredDocument(
                  (String) source.get("document_hash"),
                  (String) source.get(ChunkMetadataKeys.FILENAME),
                  (String) source.get(ChunkMetadataKeys.PARSER),
                  (String) source.get(ChunkMetadataKeys.INGESTED_AT),
                  chunkCount instanceof Number number ? number.intValue() : 0));
        }
      }
      return documents;
    } catch (IOException | ElasticsearchException e) {
      throw failure("list documents", e);
    }
  }

  @Override
  public long documentCount() {
    try {
      return elasticsearchClient.count(c -> c.index(indexName).query(isMarker())).count();
    } catch (IOException | ElasticsearchException e) {
      throw failure("count documents", e);
    }
  }

  @Override
  public int deleteDocument(String documentHash) {
    try {
      Long deleted =
          elasticsearchClient
              .deleteByQuery(
                  d ->
                      d.index(indexName)
                          .query(byChunksOf(documentHash))
                          .refresh(true))
              .deleted();
      elasticsearchClient.delete(
          d -> d.index(indexName).id(markerId(documentHash)).refresh(Refresh.WaitFor));
      int removed = deleted == null ? 0 : deleted.intValue();
      log.info("Deleted {} chunks of document {} from {}", removed, documentHash, indexName);
      meterRegistry.counter("vector_store.deleted", "store", TYPE).increment(removed);
      return removed;
    } catch (IOException | ElasticsearchException e) {
      throw failure("delete document " + documentHash, e);
    }
  }

  @Override
  public int delete(Collection<String> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (String id : ids) {
        bulkBuilder.operations(op -> op.delete(d -> d.index(indexName).id(id)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      int removed = 0;
      for (BulkResponseItem item : response.items()) {
        if ("deleted".equals(item.result())) {
          removed++;
        }
      }
      return removed;
    } catch (IOException | ElasticsearchException e) {
      throw failure("delete " + ids.size() + " records", e);
    }
  }

  @Override
  public long count() {
    try {
      return elasticsearchClient.count(c -> c.index(indexName).query(isChunk())).count();
    } catch (IOException | ElasticsearchException e) {
      throw failure("count", e);
    }
  }

  @SuppressWarnings("unchecked")
  private List<ScoredRecord> search(
      SearchRequest request, String operation, DoubleUnaryOperator toScore) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<ScoredRecord> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        if (hit.source() != null) {
          double score = hit.score() == null ? 0.0 : toScore.applyAsDouble(hit.score());
          results.add(new ScoredRecord(fromDocument(hit.id(), hit.source()), score));
        }
      }
      log.debug("[{}] index={} returned={}", operation, indexName, results.size());
      meterRegistry.counter("vector_store." + operation, "store", TYPE).increment();
      return results;
    } catch (IOException | ElasticsearchException e) {
      throw failure(operation, e);
    }
  }

  private Query chunkFilter(MetadataFilter filter) {
    List<Query> clauses = new ArrayList<>();
    clauses.add(isChunk());
    if (!MetadataFilters.isEmpty(filter)) {
      clauses.add(toQuery(filter));
    }
    return Query.of(q -> q.bool(b -> b.filter(clauses)));
  }

  static Query toQuery(MetadataFilter filter) {
    if (filter instanceof MetadataFilter.AllOf allOf) {
      List<Query> clauses = allOf.filters().stream().map(ElasticsearchStore::toQuery).toList();
      return Query.of(q -> q.bool(b -> b.filter(clauses)));
    }
    if (filter instanceof MetadataFilter.Range range) {
      String field = "metadata." + range.key();
      return Query.of(
          q ->
              q.range(
                  r ->
                      r.number(
                          n ->
                              n.field(field)
                                  .gt(range.gt())
                                  .gte(range.gte())
                                  .lt(range.lt())
                                  .lte(range.lte()))));
    }
    if (filter instanceof MetadataFilter.Exact exact) {
      String field = "metadata." + exact.key();
      if (exact.value() instanceof Collection<?> values) {
        List<FieldValue> fieldValues =
            values.stream().map(ElasticsearchStore::fieldValue).toList();
        return Query.of(q -> q.terms(t -> t.field(field).terms(tv -> tv.value(fieldValues))));
      }
      FieldValue value = fieldValue(exact.value());
      return Query.of(q -> q.term(t -> t.field(field).value(value)));
    }
    throw new IllegalArgumentException("Unsupported filter: " + filter);
  }

  private static FieldValue fieldValue(Object value) {
    if (value instanceof Boolean bool) {
      return FieldValue.of(bool);
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return FieldValue.of(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      return FieldValue.of(number.doubleValue());
    }
    return FieldValue.of(String.valueOf(value));
  }

  private static Query isChunk() {
    return Query.of(q -> q.term(t -> t.field(RECORD_TYPE).value(CHUNK)));
  }

  private static Query isMarker() {
    return Query.of(q -> q.term(t -> t.field(RECORD_TYPE).value(DOCUMENT)));
  }

  private static Query byChunksOf(String documentHash) {
    Query byDocument = Query.of(q -> q.term(t -> t.field("document_hash").value(documentHash)));
    return Query.of(q -> q.bool(b -> b.filter(isChunk(), byDocument)));
  }

  private static String markerId(String documentHash) {
    return "doc_" + documentHash;
  }

  private Map<String, Object> toDocument(VectorRecord record) {
    List<Float> vector = new ArrayList<>(record.vector().length);
    for (float v : record.vector()) {
      vector.add(v);
    }
    Map<String, Object> document = new HashMap<>();
    document.put("id", record.id());
    document.put(RECORD_TYPE, CHUNK);
    document.put("document_hash", record.documentHash());
    document.put("chunk_index", record.chunkIndex());
    document.put("chunk_hash", record.chunkHash());
    document.put("text", record.text());
    document.put("metadata", record.metadata());
    document.put("vector", vector);
    return document;
  }

  @SuppressWarnings("unchecked")
  static VectorRecord fromDocument(String id, Map<String, Object> source) {
    List<Number> rawVector = (List<Number>) source.getOrDefault("vector", List.of());
    float[] vector = new float[rawVector.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = rawVector.get(i).floatValue();
    }
    Map<String, Object> metadata = new HashMap<>();
    Object rawMetadata = source.get("metadata");
    if (rawMetadata instanceof Map<?, ?> map) {
      map.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              metadata.put(key.toString(), value);
            }
          });
    }
    return new VectorRecord(
        id,
        (String) source.get("document_hash"),
        ((Number) source.get("chunk_index")).intValue(),
        (String) source.get("text"),
        (String) source.get("chunk_hash"),
        metadata,
        vector);
  }

  private void checkDimension(float[] vector) {
    if (vector == null || vector.length != dimension) {
      throw new ConfigurationException(
          indexName
              + ": vector dimension "
              + (vector == null ? 0 : vector.length)
              + " does not match store dimension "
              + dimension);
    }
  }

  private StoreException failure(String operation, Exception e) {
    log.error("Elasticsearch {} failed on {}: {}", operation, indexName, e.getMessage(), e);
    meterRegistry.counter("vector_store.errors", "store", TYPE).increment();
    return new StoreException(indexName, "Elasticsearch " + operation + " failed", e);
  }
}

package com.flamingo.ai.ragpipeline.service.database;

import com.flamingo.ai.ragpipeline.domain.entity.DatasetDocument;
import com.flamingo.ai.ragpipeline.domain.repository.DatasetDocumentRepository;
import com.flamingo.ai.ragpipeline.exception.DocumentNotFoundException;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedDatabase;
import com.flamingo.ai.ragpipeline.service.rag.resolver.StrategyResolver;
import com.flamingo.ai.ragpipeline.service.rag.store.StoredDocument;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorRecord;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only views of what a database holds: counts, stored documents and their chunks.
 *
 * <p>Counts come from the vector store. Dataset membership and file sizes come from the dataset
 * rows that reference each content hash.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatabaseInspectionService {

  /** Every store searches vectors by cosine similarity. */
  public static final String DISTANCE_METRIC = "cosine";

  public static final int DEFAULT_DOCUMENT_LIMIT = 100;
  public static final int MAX_DOCUMENT_LIMIT = 1000;
  public static final int DEFAULT_CHUNK_LIMIT = 20;
  public static final int MAX_CHUNK_LIMIT = 1000;

  private static final Comparator<StoredDocument> BY_FILE_NAME =
      Comparator.comparing(
              DatabaseInspectionService::sortName, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(StoredDocument::documentHash);

  private final StrategyResolver strategyResolver;
  private final DatasetDocumentRepository documentRepository;

  public DatabaseStats stats(String databaseName) {
    VectorStore store = strategyResolver.resolveDatabase(databaseName).store();
    long chunks = store.count();
    long documents = store.documentCount();
    log.debug("Database '{}' holds {} chunk(s) of {} document(s)", databaseName, chunks, documents);
    return new DatabaseStats(
        databaseName, store.type(), chunks, documents, chunks, store.dimension(), DISTANCE_METRIC);
  }

  /** Lists stored documents ordered by file name, case-insensitively. */
  @Transactional(readOnly = true)
  public DocumentPage listDocuments(String databaseName, int limit, int offset) {
    checkRange("limit", limit, 1, MAX_DOCUMENT_LIMIT);
    checkRange("offset", offset, 0, Integer.MAX_VALUE);
    ResolvedDatabase database = strategyResolver.resolveDatabase(databaseName);
    List<StoredDocument> stored =
        database.store().listDocuments().stream().sorted(BY_FILE_NAME).toList();
    List<StoredDocument> page = stored.stream().skip(offset).limit(limit).toList();

    Map<String, List<DatasetDocument>> references =
        page.isEmpty()
            ? Map.of()
            : documentRepository
                .findInDatabaseByContentHashes(
                    databaseName, page.stream().map(StoredDocument::documentHash).toList())
                .stream()
                .collect(Collectors.groupingBy(DatasetDocument::getContentHash));

    List<DocumentSummary> summaries =
        page.stream()
            .map(
                document ->
                    summarize(
                        document, references.getOrDefault(document.documentHash(), List.of())))
            .toList();
    return new DocumentPage(databaseName, summaries, stored.size(), limit, offset);
  }

  /**
   * Returns the first chunks of a stored document in chunk order.
   *
   * @throws DocumentNotFoundException if the database does not hold the document
   */
  public DocumentChunks documentChunks(String databaseName, String documentHash, int limit) {
    checkRange("limit", limit, 1, MAX_CHUNK_LIMIT);
    VectorStore store = strategyResolver.resolveDatabase(databaseName).store();
    if (!store.containsDocument(documentHash)) {
      throw new DocumentNotFoundException(databaseName, documentHash);
    }
    List<VectorRecord> chunks = store.getDocumentChunks(documentHash);
    return new DocumentChunks(
        databaseName,
        documentHash,
        chunks.size(),
        chunks.subList(0, Math.min(limit, chunks.size())));
  }

  private static DocumentSummary summarize(
      StoredDocument document, List<DatasetDocument> references) {
    long sizeBytes =
        references.stream()
            .map(DatasetDocument::getFileSize)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(0L);
    List<String> datasets =
        List.copyOf(
            references.stream()
                .map(reference -> reference.getDataset().getName())
                .collect(Collectors.toCollection(TreeSet::new)));
    String fileName = document.fileName();
    if (fileName == null && !references.isEmpty()) {
      fileName = references.get(0).getFileName();
    }
    return new DocumentSummary(
        document.documentHash(),
        fileName,
        document.chunkCount(),
        sizeBytes,
        document.parser(),
        document.ingestedAt(),
        datasets);
  }

  private static String sortName(StoredDocument document) {
    return document.fileName() == null ? null : document.fileName().toLowerCase(Locale.ROOT);
  }

  private static void checkRange(String name, int value, int min, int max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          name + " must be between " + min + " and " + max + ", got " + value);
    }
  }
}

package com.flamingo.ai.ragpipeline.service.dataset;

import com.flamingo.ai.ragpipeline.domain.entity.Dataset;
import com.flamingo.ai.ragpipeline.domain.entity.DatasetDocument;
import com.flamingo.ai.ragpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.ragpipeline.domain.repository.DatasetDocumentRepository;
import com.flamingo.ai.ragpipeline.domain.repository.DatasetRepository;
import com.flamingo.ai.ragpipeline.exception.DatabaseNotFoundException;
import com.flamingo.ai.ragpipeline.exception.DatasetAlreadyExistsException;
import com.flamingo.ai.ragpipeline.exception.DatasetBusyException;
import com.flamingo.ai.ragpipeline.exception.DatasetNotFoundException;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionFile;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionJob;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTask;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTaskOrchestrator;
import com.flamingo.ai.ragpipeline.service.ingestion.IngestionTaskStore;
import com.flamingo.ai.ragpipeline.service.rag.resolver.StrategyResolver;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DatasetService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatasetServiceImpl implements DatasetService {

  private final DatasetRepository datasetRepository;
  private final DatasetDocumentRepository documentRepository;
  private final StrategyResolver strategyResolver;
  private final RawFileStorage rawFileStorage;
  private final IngestionTaskOrchestrator orchestrator;
  private final IngestionTaskStore taskStore;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "dataset.create", description = "Time to create a dataset")
  public Dataset createDataset(
      String name, String description, String processingStrategy, String databaseName) {
    if (datasetRepository.existsByName(name)) {
      throw new DatasetAlreadyExistsException(name);
    }
    strategyResolver.resolvePipeline(processingStrategy, databaseName);

    Dataset dataset =
        Dataset.builder()
            .name(name)
            .description(description)
            .processingStrategy(processingStrategy)
            .databaseName(databaseName)
            .build();
    Dataset saved = datasetRepository.save(dataset);
    meterRegistry.counter("dataset.created").increment();
    log.info(
        "Created dataset '{}' (strategy '{}', database '{}')",
        name,
        processingStrategy,
        databaseName);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Dataset> listDatasets() {
    return datasetRepository.findAllByOrderByCreatedAtDesc();
  }

  @Override
  @Transactional(readOnly = true)
  public Dataset getDataset(String name) {
    return datasetRepository.findByName(name).orElseThrow(() -> new DatasetNotFoundException(name));
  }

  @Override
  @Transactional(readOnly = true)
  public List<DatasetDocument> getDocuments(String name) {
    return documentRepository.findByDatasetIdOrderByUploadedAtAsc(getDataset(name).getId());
  }

  @Override
  @Transactional
  @Timed(value = "dataset.upload", description = "Time to upload files to a dataset")
  public List<UploadResult> uploadFiles(String name, List<MultipartFile> files) {
    Dataset dataset = getDataset(name);
    List<UploadResult> results = new ArrayList<>();
    for (MultipartFile file : files) {
      String fileName = sanitizeFileName(file.getOriginalFilename());
      RawFileStorage.StoredFile stored;
      try (InputStream content = file.getInputStream()) {
        stored = rawFileStorage.store(content);
      } catch (IOException e) {
        log.error("Failed to store upload {} for dataset '{}'", fileName, name, e);
        throw new UncheckedIOException("Failed to store " + fileName, e);
      }

      Optional<DatasetDocument> existing =
          documentRepository.findByDatasetIdAndContentHash(dataset.getId(), stored.contentHash());
      if (existing.isPresent()) {
        log.info(
            "Upload {} to dataset '{}' has the same content as {}",
            fileName,
            name,
            existing.get().getFileName());
        results.add(
            new UploadResult(
                fileName,
                stored.contentHash(),
                existing.get().getStatus() == DocumentStatus.INGESTED,
                true));
        continue;
      }

      DatasetDocument document =
          DatasetDocument.builder()
              .fileName(fileName)
              .contentHash(stored.contentHash())
              .mimeType(file.getContentType())
              .fileSize(stored.sizeBytes())
              .build();
      dataset.addDocument(document);
      documentRepository.save(document);
      meterRegistry.counter("dataset.file.uploaded").increment();
      results.add(new UploadResult(fileName, stored.contentHash(), false, false));
    }
    log.info("Uploaded {} file(s) to dataset '{}'", files.size(), name);
    return results;
  }

  @Override
  @Transactional
  @Timed(value = "dataset.process", description = "Time to submit dataset processing")
  public IngestionTask processDataset(String name, boolean includeIngested) {
    Dataset dataset = getDataset(name);
    strategyResolver.resolvePipeline(dataset.getProcessingStrategy(), dataset.getDatabaseName());

    List<DatasetDocument> documents =
        includeIngested
            ? documentRepository.findByDatasetIdOrderByUploadedAtAsc(dataset.getId())
            : documentRepository.findByDatasetIdAndStatusIn(
                dataset.getId(),
                List.of(DocumentStatus.PENDING, DocumentStatus.PROCESSING, DocumentStatus.FAILED));

    List<IngestionFile> files = new ArrayList<>();
    for (DatasetDocument document : documents) {
      files.add(
          new IngestionFile(
              document.getFileName(),
              document.getContentHash(),
              rawFileStorage.resolve(document.getContentHash()),
              document.getMimeType(),
              document.getFileSize() != null ? document.getFileSize() : 0L,
              document.getId()));
    }

    IngestionTask task =
        orchestrator.prepare(
            new IngestionJob(
                name, dataset.getProcessingStrategy(), dataset.getDatabaseName(), files));

    // Start after commit so workers see the committed document rows
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              orchestrator.start(task);
            }
          });
    } else {
      orchestrator.start(task);
    }
    return task;
  }

  @Override
  public List<IngestionTask> getTasks(String name) {
    getDataset(name);
    return taskStore.findByDataset(name);
  }

  @Override
  @Transactional
  @Timed(value = "dataset.delete", description = "Time to delete a dataset")
  public void deleteDataset(String name) {
    Dataset dataset = getDataset(name);
    List<IngestionTask> running = orchestrator.cancelDatasetTasks(name);
    if (!running.isEmpty()) {
      throw new DatasetBusyException(name, running.stream().map(IngestionTask::getId).toList());
    }
    List<DatasetDocument> documents =
        documentRepository.findByDatasetIdOrderByUploadedAtAsc(dataset.getId());

    VectorStore store = null;
    try {
      store = strategyResolver.resolveDatabase(dataset.getDatabaseName()).store();
    } catch (DatabaseNotFoundException e) {
      log.warn(
          "Database '{}' of dataset '{}' is no longer configured, keeping its vectors",
          dataset.getDatabaseName(),
          name);
    }

    int removedVectors = 0;
    for (DatasetDocument document : documents) {
      String hash = document.getContentHash();
      if (store != null
          && documentRepository.countOtherReferencesInDatabase(
                  hash, dataset.getDatabaseName(), dataset.getId())
              == 0) {
        removedVectors += store.deleteDocument(hash);
      }
      if (documentRepository.countOtherReferences(hash, dataset.getId()) == 0) {
        deleteRawFile(hash);
      }
    }

    datasetRepository.delete(dataset);
    meterRegistry.counter("dataset.deleted").increment();
    log.info(
        "Deleted dataset '{}' with {} document(s) and {} vector(s)",
        name,
        documents.size(),
        removedVectors);
  }

  private void deleteRawFile(String contentHash) {
    try {
      rawFileStorage.delete(contentHash);
    } catch (IOException e) {
      log.warn("Failed to delete raw content {}: {}", contentHash, e.getMessage());
    }
  }

  /** Normalizes an uploaded name to a relative path with forward slashes. */
  static String sanitizeFileName(String originalName) {
    if (originalName == null || originalName.isBlank()) {
      throw new IllegalArgumentException("Uploaded file has no name");
    }
    String normalized = originalName.replace('\\', '/');
    while (normalized.startsWith("/") || normalized.startsWith("./")) {
      normalized = normalized.startsWith("/") ? normalized.substring(1) : normalized.substring(2);
    }
    for (String segment : normalized.split("/")) {
      if (segment.equals("..")) {
        throw new IllegalArgumentException(
            "File name must stay inside the dataset: " + originalName);
      }
    }
    if (normalized.isBlank()) {
      throw new IllegalArgumentException("Uploaded file has no name");
    }
    return normalized;
  }
}

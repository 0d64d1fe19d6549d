package com.flamingo.ai.ragpipeline.service.ingestion;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.domain.entity.DatasetDocument;
import com.flamingo.ai.ragpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.ragpipeline.domain.repository.DatasetDocumentRepository;
import com.flamingo.ai.ragpipeline.exception.ConfigurationException;
import com.flamingo.ai.ragpipeline.exception.TaskNotFoundException;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedPipeline;
import com.flamingo.ai.ragpipeline.service.rag.resolver.StrategyResolver;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs ingestion tasks in the background.
 *
 * <p>{@link #submit} returns at once with a {@code PENDING} task. The task thread resolves the
 * pipeline, then hands each file to the file pool; at most {@code rag.ingestion.max-concurrent-
 * files} files are processed at a time across all tasks. Files not yet started when cancellation
 * is requested are recorded as {@code CANCELLED}; files in flight run to completion.
 */
@Service
@Slf4j
public class IngestionTaskOrchestrator {

  private final StrategyResolver strategyResolver;
  private final FileIngestionService fileIngestionService;
  private final IngestionTaskStore taskStore;
  private final DatasetDocumentRepository documentRepository;
  private final MeterRegistry meterRegistry;
  private final Executor taskExecutor;
  private final Executor fileExecutor;
  private final Semaphore filePermits;

  /** Document hashes currently being ingested, keyed by database. */
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public IngestionTaskOrchestrator(
      StrategyResolver strategyResolver,
      FileIngestionService fileIngestionService,
      IngestionTaskStore taskStore,
      DatasetDocumentRepository documentRepository,
      MeterRegistry meterRegistry,
      RagConfig ragConfig,
      @Qualifier("ingestionTaskExecutor") Executor taskExecutor,
      @Qualifier("fileProcessingExecutor") Executor fileExecutor) {
    this.strategyResolver = strategyResolver;
    this.fileIngestionService = fileIngestionService;
    this.taskStore = taskStore;
    this.documentRepository = documentRepository;
    this.meterRegistry = meterRegistry;
    this.taskExecutor = taskExecutor;
    this.fileExecutor = fileExecutor;
    this.filePermits =
        new Semaphore(Math.max(1, ragConfig.getIngestion().getMaxConcurrentFiles()));
  }

  /**
   * Submits a job for background ingestion.
   *
   * @return the task handle in state {@code PENDING}
   */
  public IngestionTask submit(IngestionJob job) {
    return start(prepare(job));
  }

  /** Registers a {@code PENDING} task without starting it; see {@link #start}. */
  public IngestionTask prepare(IngestionJob job) {
    IngestionTask task = new IngestionTask(UUID.randomUUID().toString(), job);
    taskStore.save(task);
    return task;
  }

  /** Starts a task registered with {@link #prepare}. */
  public IngestionTask start(IngestionTask task) {
    IngestionJob job = task.getJob();
    log.info(
        "Submitted ingestion task {} for dataset '{}' ({} files, strategy '{}', database '{}')",
        task.getId(),
        job.datasetName(),
        job.files().size(),
        job.strategyName(),
        job.databaseName());
    meterRegistry.counter("ingestion.task.submitted").increment();
    try {
      taskExecutor.execute(() -> run(task));
    } catch (RejectedExecutionException e) {
      log.error("Ingestion task {} rejected: {}", task.getId(), e.getMessage());
      failAll(task, "Ingestion queue is full, retry later");
    }
    return task;
  }

  public IngestionTask getTask(String taskId) {
    return taskStore.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  /**
   * Requests cancellation of a task. Returns the task; a finished task is returned unchanged.
   *
   * @throws TaskNotFoundException if the task is unknown
   */
  public IngestionTask cancel(String taskId) {
    IngestionTask task = getTask(taskId);
    if (task.requestCancel()) {
      log.info("Cancellation requested for ingestion task {}", taskId);
    } else {
      log.debug("Ingestion task {} already finished in state {}", taskId, task.getState());
    }
    return task;
  }

  /**
   * Requests cancellation of every unfinished task of a dataset. Pending tasks will cancel all
   * their files when they run; running tasks still finish the files they have in flight.
   *
   * @return the tasks that were already running when cancellation was requested
   */
  public List<IngestionTask> cancelDatasetTasks(String datasetName) {
    List<IngestionTask> running = new ArrayList<>();
    for (IngestionTask task : taskStore.findByDataset(datasetName)) {
      if (!task.requestCancel()) {
        continue;
      }
      log.info("Cancellation requested for ingestion task {} of '{}'", task.getId(), datasetName);
      if (task.getState() == TaskState.RUNNING) {
        running.add(task);
      }
    }
    return running;
  }

  void run(IngestionTask task) {
    IngestionJob job = task.getJob();
    task.markRunning();
    if (task.isCancelRequested()) {
      log.info("Ingestion task {} was cancelled before it started", task.getId());
      cancelRemaining(task);
      complete(task, null);
      return;
    }

    ResolvedPipeline pipeline;
    try {
      pipeline = strategyResolver.resolvePipeline(job.strategyName(), job.databaseName());
    } catch (ConfigurationException e) {
      log.error("Ingestion task {} has an invalid pipeline: {}", task.getId(), e.getMessage());
      failAll(task, e.getMessage());
      return;
    }

    List<CompletableFuture<Void>> running = new ArrayList<>();
    List<IngestionFile> files = job.files();
    for (int index = 0; index < files.size(); index++) {
      IngestionFile file = files.get(index);
      if (!acquirePermit(task)) {
        task.recordOutcome(index, FileOutcome.cancelled(file));
        continue;
      }
      if (task.isCancelRequested()) {
        filePermits.release();
        task.recordOutcome(index, FileOutcome.cancelled(file));
        continue;
      }
      int fileIndex = index;
      try {
        running.add(
            CompletableFuture.runAsync(
                () -> processFile(task, fileIndex, file, pipeline), fileExecutor));
      } catch (RejectedExecutionException e) {
        filePermits.release();
        log.error("File {} of task {} rejected: {}", file.fileName(), task.getId(), e.getMessage());
        task.recordOutcome(index, FileOutcome.failed(file, null, "File worker pool is full"));
      }
    }

    CompletableFuture.allOf(running.toArray(CompletableFuture[]::new)).join();
    complete(task, null);
  }

  private boolean acquirePermit(IngestionTask task) {
    try {
      filePermits.acquire();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Ingestion task {} interrupted while waiting for a file slot", task.getId());
      task.requestCancel();
      return false;
    }
  }

  private void processFile(
      IngestionTask task, int index, IngestionFile file, ResolvedPipeline pipeline) {
    String claim = pipeline.databaseName() + "::" + file.contentHash();
    try {
      if (!inFlight.add(claim)) {
        log.info("Skipping {}: same content is being ingested concurrently", file.fileName());
        record(task, index, file, FileOutcome.duplicate(file));
        return;
      }
      try {
        if (!documentStillExists(file)) {
          log.info("Skipping {}: its dataset document was removed", file.fileName());
          record(task, index, file, FileOutcome.cancelled(file));
          return;
        }
        markDocument(file, DatasetDocument::startProcessing);
        record(task, index, file, ingestSafely(task, file, pipeline));
      } finally {
        inFlight.remove(claim);
      }
    } finally {
      filePermits.release();
    }
  }

  private boolean documentStillExists(IngestionFile file) {
    return file.documentId() == null || documentRepository.existsById(file.documentId());
  }

  private FileOutcome ingestSafely(
      IngestionTask task, IngestionFile file, ResolvedPipeline pipeline) {
    try {
      return fileIngestionService.ingest(file, pipeline, task.getJob().datasetName());
    } catch (RuntimeException e) {
      log.error("Unexpected error ingesting {} in task {}", file.fileName(), task.getId(), e);
      return FileOutcome.failed(file, null, "Unexpected error: " + e.getMessage());
    }
  }

  private void record(IngestionTask task, int index, IngestionFile file, FileOutcome outcome) {
    task.recordOutcome(index, outcome);
    meterRegistry
        .counter("ingestion.file." + outcome.status().name().toLowerCase(Locale.ROOT))
        .increment();
    switch (outcome.status()) {
      case PROCESSED ->
          markDocument(file, document -> document.markIngested(outcome.storedChunks()));
      case SKIPPED_DUPLICATE -> markDocument(file, IngestionTaskOrchestrator::markDuplicate);
      case FAILED, SKIPPED_UNSUPPORTED ->
          markDocument(file, document -> document.markFailed(outcome.error()));
      default -> markDocument(file, document -> document.setStatus(DocumentStatus.PENDING));
    }
  }

  private static void markDuplicate(DatasetDocument document) {
    int chunkCount = document.getChunkCount() != null ? document.getChunkCount() : 0;
    document.markIngested(chunkCount);
  }

  private void markDocument(IngestionFile file, Consumer<DatasetDocument> update) {
    if (file.documentId() == null) {
      return;
    }
    try {
      documentRepository
          .findById(file.documentId())
          .ifPresent(
              document -> {
                update.accept(document);
                documentRepository.save(document);
              });
    } catch (RuntimeException e) {
      log.warn("Failed to update document row for {}: {}", file.fileName(), e.getMessage());
    }
  }

  private void failAll(IngestionTask task, String error) {
    List<IngestionFile> files = task.getJob().files();
    for (int index = 0; index < files.size(); index++) {
      if (!task.hasOutcome(index)) {
        record(task, index, files.get(index), FileOutcome.failed(files.get(index), null, error));
      }
    }
    complete(task, error);
  }

  private void cancelRemaining(IngestionTask task) {
    List<IngestionFile> files = task.getJob().files();
    for (int index = 0; index < files.size(); index++) {
      if (!task.hasOutcome(index)) {
        record(task, index, files.get(index), FileOutcome.cancelled(files.get(index)));
      }
    }
  }

  private void complete(IngestionTask task, String error) {
    TaskState state = task.complete(error);
    taskStore.evictFinished();
    meterRegistry.counter("ingestion.task." + state.name().toLowerCase(Locale.ROOT)).increment();
    log.info("Ingestion task {} finished as {}: {}", task.getId(), state, task.getCounts());
  }
}

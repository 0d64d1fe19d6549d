package com.flamingo.ai.ragpipeline.service.ingestion;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Handle of an asynchronous ingestion task. State and outcomes are written by the worker threads
 * and read by status requests, so every accessor is safe to call concurrently.
 */
public class IngestionTask {

  private final String id;
  private final IngestionJob job;
  private final Instant submittedAt;
  private final AtomicReferenceArray<FileOutcome> outcomes;
  private final AtomicBoolean cancelRequested = new AtomicBoolean();

  private volatile TaskState state = TaskState.PENDING;
  private volatile Instant startedAt;
  private volatile Instant finishedAt;
  private volatile String error;

  public IngestionTask(String id, IngestionJob job) {
    this.id = id;
    this.job = job;
    this.submittedAt = Instant.now();
    this.outcomes = new AtomicReferenceArray<>(job.files().size());
  }

  public String getId() {
    return id;
  }

  public IngestionJob getJob() {
    return job;
  }

  public TaskState getState() {
    return state;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public String getError() {
    return error;
  }

  public boolean isCancelRequested() {
    return cancelRequested.get();
  }

  /** Requests cancellation; returns false if the task had already finished. */
  public synchronized boolean requestCancel() {
    if (state.isTerminal()) {
      return false;
    }
    cancelRequested.set(true);
    return true;
  }

  void markRunning() {
    startedAt = Instant.now();
    state = TaskState.RUNNING;
  }

  void recordOutcome(int fileIndex, FileOutcome outcome) {
    outcomes.set(fileIndex, outcome);
  }

  /** Whether the file at the index already has an outcome. */
  boolean hasOutcome(int fileIndex) {
    return outcomes.get(fileIndex) != null;
  }

  /**
   * Finishes the task, {@code FAILED} with the error if one is given, otherwise in the state
   * derived from the outcomes. Serialized with {@link #requestCancel}.
   */
  synchronized TaskState complete(String errorDetail) {
    TaskState finalState = errorDetail != null ? TaskState.FAILED : deriveFinalState();
    finish(finalState, errorDetail);
    return finalState;
  }

  synchronized void finish(TaskState finalState, String errorDetail) {
    error = errorDetail;
    finishedAt = Instant.now();
    state = finalState;
  }

  /** Outcomes recorded so far, in submission order. */
  public List<FileOutcome> getOutcomes() {
    List<FileOutcome> recorded = new ArrayList<>();
    for (int i = 0; i < outcomes.length(); i++) {
      FileOutcome outcome = outcomes.get(i);
      if (outcome != null) {
        recorded.add(outcome);
      }
    }
    return Collections.unmodifiableList(recorded);
  }

  public Optional<FileOutcome> getOutcome(int fileIndex) {
    return Optional.ofNullable(outcomes.get(fileIndex));
  }

  /** Number of files per status; files still in progress are not counted. */
  public Map<FileStatus, Integer> getCounts() {
    Map<FileStatus, Integer> counts = new EnumMap<>(FileStatus.class);
    for (FileStatus status : FileStatus.values()) {
      counts.put(status, 0);
    }
    for (FileOutcome outcome : getOutcomes()) {
      counts.merge(outcome.status(), 1, Integer::sum);
    }
    return counts;
  }

  public int getTotalFiles() {
    return outcomes.length();
  }

  /**
   * Derives the final state from the recorded outcomes.
   *
   * @return {@code CANCELLED} if any file was cancelled, otherwise {@code SUCCEEDED} when nothing
   *     failed, {@code FAILED} when nothing was stored, {@code PARTIAL} in between
   */
  TaskState deriveFinalState() {
    Map<FileStatus, Integer> counts = getCounts();
    if (counts.get(FileStatus.CANCELLED) > 0) {
      return TaskState.CANCELLED;
    }
    int problems = counts.get(FileStatus.FAILED) + counts.get(FileStatus.SKIPPED_UNSUPPORTED);
    if (problems == 0) {
      return TaskState.SUCCEEDED;
    }
    int stored = counts.get(FileStatus.PROCESSED) + counts.get(FileStatus.SKIPPED_DUPLICATE);
    return stored == 0 ? TaskState.FAILED : TaskState.PARTIAL;
  }
}

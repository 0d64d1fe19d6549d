package com.flamingo.ai.ragpipeline.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IngestionTask Tests")
class IngestionTaskTest {

  private IngestionFile first;
  private IngestionFile second;
  private IngestionTask task;

  @BeforeEach
  void setUp() {
    first = new IngestionFile("a.txt", "h1", Path.of("a.txt"), null, 1, null);
    second = new IngestionFile("b.txt", "h2", Path.of("b.txt"), null, 1, null);
    task = new IngestionTask("t1", new IngestionJob("docs", "s", "db", List.of(first, second)));
  }

  @Test
  @DisplayName("should start pending with no outcomes")
  void shouldStartPending() {
    assertThat(task.getState()).isEqualTo(TaskState.PENDING);
    assertThat(task.getOutcomes()).isEmpty();
    assertThat(task.getTotalFiles()).isEqualTo(2);
    assertThat(task.getCounts()).containsEntry(FileStatus.PROCESSED, 0);
  }

  @Test
  @DisplayName("should derive succeeded when only duplicates and processed files exist")
  void shouldDeriveSucceeded() {
    task.recordOutcome(0, FileOutcome.processed(first, "text", 1, 1, List.of()));
    task.recordOutcome(1, FileOutcome.duplicate(second));

    assertThat(task.deriveFinalState()).isEqualTo(TaskState.SUCCEEDED);
  }

  @Test
  @DisplayName("should derive failed when nothing was stored")
  void shouldDeriveFailed() {
    task.recordOutcome(0, FileOutcome.failed(first, null, "x"));
    task.recordOutcome(1, FileOutcome.unsupported(second, "y"));

    assertThat(task.deriveFinalState()).isEqualTo(TaskState.FAILED);
  }

  @Test
  @DisplayName("should derive partial when some files were stored")
  void shouldDerivePartial() {
    task.recordOutcome(0, FileOutcome.processed(first, "text", 1, 1, List.of()));
    task.recordOutcome(1, FileOutcome.unsupported(second, "y"));

    assertThat(task.deriveFinalState()).isEqualTo(TaskState.PARTIAL);
  }

  @Test
  @DisplayName("should derive cancelled when any file was cancelled")
  void shouldDeriveCancelled() {
    task.recordOutcome(0, FileOutcome.failed(first, null, "x"));
    task.recordOutcome(1, FileOutcome.cancelled(second));

    assertThat(task.deriveFinalState()).isEqualTo(TaskState.CANCELLED);
  }

  @Test
  @DisplayName("should refuse cancellation after finishing")
  void shouldRefuseCancelWhenFinished() {
    assertThat(task.requestCancel()).isTrue();

    task.finish(TaskState.CANCELLED, null);

    assertThat(task.requestCancel()).isFalse();
    assertThat(task.getState().isTerminal()).isTrue();
  }

  @Test
  @DisplayName("should leave the cancel flag untouched when asked after completion")
  void shouldIgnoreCancelAfterComplete() {
    task.recordOutcome(0, FileOutcome.processed(first, "text", 1, 1, List.of()));
    task.recordOutcome(1, FileOutcome.duplicate(second));

    assertThat(task.complete(null)).isEqualTo(TaskState.SUCCEEDED);

    assertThat(task.requestCancel()).isFalse();
    assertThat(task.isCancelRequested()).isFalse();
    assertThat(task.getState()).isEqualTo(TaskState.SUCCEEDED);
  }

  @Test
  @DisplayName("should only report an accepted cancel that the final state reflects")
  void shouldKeepCancelAndCompletionConsistent() throws Exception {
    for (int round = 0; round < 200; round++) {
      IngestionTask racing =
          new IngestionTask("t" + round, new IngestionJob("docs", "s", "db", List.of(first)));
      racing.markRunning();
      CountDownLatch start = new CountDownLatch(1);
      ExecutorService pool = Executors.newFixedThreadPool(2);
      try {
        Future<Boolean> cancel =
            pool.submit(
                () -> {
                  start.await();
                  return racing.requestCancel();
                });
        Future<TaskState> completion =
            pool.submit(
                () -> {
                  start.await();
                  if (racing.isCancelRequested()) {
                    racing.recordOutcome(0, FileOutcome.cancelled(first));
                  } else {
                    racing.recordOutcome(0, FileOutcome.processed(first, "text", 1, 1, List.of()));
                  }
                  return racing.complete(null);
                });
        start.countDown();

        boolean accepted = cancel.get(5, TimeUnit.SECONDS);
        completion.get(5, TimeUnit.SECONDS);
        assertThat(racing.isCancelRequested()).isEqualTo(accepted);
        assertThat(racing.getState().isTerminal()).isTrue();
      } finally {
        pool.shutdownNow();
      }
    }
  }

  @Test
  @DisplayName("should count failed chunks of a processed file")
  void shouldCountFailedChunks() {
    FileOutcome outcome = FileOutcome.processed(first, "text", 5, 3, List.of());

    assertThat(outcome.failedChunks()).isEqualTo(2);
    assertThat(outcome.status().isStored()).isTrue();
  }
}

package com.flamingo.ai.ragpipeline.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

import com.flamingo.ai.ragpipeline.config.RagConfig;
import com.flamingo.ai.ragpipeline.domain.repository.DatasetDocumentRepository;
import com.flamingo.ai.ragpipeline.service.hash.ContentHasher;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingSettings;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingStrategy;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import com.flamingo.ai.ragpipeline.service.rag.embedding.Embedder;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingExecutor;
import com.flamingo.ai.ragpipeline.service.rag.embedding.HashingEmbedder;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ExtractorPipeline;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ConfiguredParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ParserChain;
import com.flamingo.ai.ragpipeline.service.rag.parsing.TextParser;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedDatabase;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedPipeline;
import com.flamingo.ai.ragpipeline.service.rag.resolver.StrategyResolver;
import com.flamingo.ai.ragpipeline.service.rag.routing.ContentSniffer;
import com.flamingo.ai.ragpipeline.service.rag.routing.FormatRouter;
import com.flamingo.ai.ragpipeline.service.rag.store.InMemoryStore;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Runs whole ingestion tasks through real routing, parsing, embedding and storage. */
@ExtendWith(MockitoExtension.class)
@DisplayName("Ingestion workflow Tests")
class IngestionWorkflowTest {

  private static final int DIMENSION = 64;

  @Mock private StrategyResolver strategyResolver;
  @Mock private DatasetDocumentRepository documentRepository;

  @TempDir Path tempDir;

  private final ContentHasher contentHasher = new ContentHasher();

  private SimpleMeterRegistry meterRegistry;
  private InMemoryStore store;
  private RagConfig ragConfig;
  private FileIngestionService fileIngestionService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    store = new InMemoryStore("main_database", DIMENSION);
    ragConfig = new RagConfig();
    fileIngestionService =
        new FileIngestionService(
            new FormatRouter(new ContentSniffer()), new ParserChain(), contentHasher);
    lenient().when(documentRepository.existsById(any())).thenReturn(true);
  }

  private void usePipeline(Embedder embedder) {
    EmbeddingExecutor executor =
        new EmbeddingExecutor(
            "main_database",
            embedder,
            RetryRegistry.ofDefaults(),
            CircuitBreakerRegistry.ofDefaults(),
            meterRegistry);
    TextParser textParser =
        new TextParser(
            new TextChunker(ChunkingSettings.defaults(ChunkingStrategy.PARAGRAPHS)),
            StandardCharsets.UTF_8,
            1024);
    ConfiguredParser text =
        new ConfiguredParser(
            "text", textParser, 80, 0, Set.of("txt"), Set.of("text/plain"), List.of());
    ResolvedPipeline pipeline =
        new ResolvedPipeline(
            "plain_text",
            List.of(text),
            List.of(),
            ExtractorPipeline.empty(),
            new ResolvedDatabase("main_database", executor, store, Map.of(), "semantic"));
    lenient()
        .when(strategyResolver.resolvePipeline("plain_text", "main_database"))
        .thenReturn(pipeline);
  }

  private IngestionTaskOrchestrator orchestrator(Executor taskExecutor, Executor fileExecutor) {
    return new IngestionTaskOrchestrator(
        strategyResolver,
        fileIngestionService,
        new IngestionTaskStore(ragConfig),
        documentRepository,
        meterRegistry,
        ragConfig,
        taskExecutor,
        fileExecutor);
  }

  private IngestionFile file(String name, byte[] content) throws IOException {
    Path path = tempDir.resolve(UUID.randomUUID() + "-" + name.replace('/', '_'));
    Files.write(path, content);
    return new IngestionFile(
        name, contentHasher.hashBytes(content), path, null, content.length, UUID.randomUUID());
  }

  private IngestionFile textFile(String name, String content) throws IOException {
    return file(name, content.getBytes(StandardCharsets.UTF_8));
  }

  private static IngestionJob job(List<IngestionFile> files) {
    return new IngestionJob("docs", "plain_text", "main_database", files);
  }

  @Test
  @DisplayName("should report a partial task with one outcome per file for a mixed batch")
  void shouldReportMixedBatchAsPartial() throws IOException {
    usePipeline(new HashingEmbedder(DIMENSION, 16));
    IngestionFile first = textFile("alpha.txt", "Alpha notes about vector stores.");
    IngestionFile second = textFile("beta.txt", "Beta notes about parsers and routing.");
    IngestionFile copy = textFile("alpha-copy.txt", "Alpha notes about vector stores.");
    IngestionFile image =
        file("diagram.png", new byte[] {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0});
    IngestionFile broken = file("broken.txt", new byte[] {'a', 'b', (byte) 0xC3, 0x28, 'c'});

    IngestionTask task =
        orchestrator(Runnable::run, Runnable::run)
            .submit(job(List.of(first, image, copy, broken, second)));

    assertThat(task.getState()).isEqualTo(TaskState.PARTIAL);
    assertThat(task.getOutcomes())
        .extracting(FileOutcome::status)
        .containsExactly(
            FileStatus.PROCESSED,
            FileStatus.SKIPPED_UNSUPPORTED,
            FileStatus.SKIPPED_DUPLICATE,
            FileStatus.FAILED,
            FileStatus.PROCESSED);
    assertThat(task.getCounts())
        .containsEntry(FileStatus.PROCESSED, 2)
        .containsEntry(FileStatus.SKIPPED_DUPLICATE, 1)
        .containsEntry(FileStatus.SKIPPED_UNSUPPORTED, 1)
        .containsEntry(FileStatus.FAILED, 1)
        .containsEntry(FileStatus.CANCELLED, 0);
    assertThat(task.getCounts().values().stream().mapToInt(Integer::intValue).sum())
        .isEqualTo(task.getTotalFiles());
    assertThat(task.getOutcome(3).orElseThrow().error()).contains("broken.txt");
    assertThat(store.containsDocument(first.contentHash())).isTrue();
    assertThat(store.containsDocument(second.contentHash())).isTrue();
    assertThat(store.containsDocument(broken.contentHash())).isFalse();
    assertThat(store.count()).isEqualTo(2);
  }

  @Test
  @DisplayName("should store identical content submitted by two concurrent tasks exactly once")
  void shouldStoreConcurrentDuplicateOnce() throws Exception {
    usePipeline(new SlowEmbedder(new HashingEmbedder(DIMENSION, 16)));
    String content = "Shared handbook.\n\nChapter one covers retries.\n\nChapter two covers locks.";
    IngestionFile fromFirst = textFile("handbook.txt", content);
    IngestionFile fromSecond = textFile("copy/handbook.txt", content);

    ExecutorService taskPool = Executors.newFixedThreadPool(2);
    ExecutorService filePool = Executors.newFixedThreadPool(4);
    IngestionTaskOrchestrator orchestrator = orchestrator(taskPool, filePool);
    IngestionTask firstTask;
    IngestionTask secondTask;
    try {
      firstTask = orchestrator.submit(job(List.of(fromFirst)));
      secondTask = orchestrator.submit(job(List.of(fromSecond)));
      taskPool.shutdown();
      assertThat(taskPool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    } finally {
      taskPool.shutdownNow();
      filePool.shutdownNow();
    }

    List<FileStatus> statuses =
        List.of(
            firstTask.getOutcome(0).orElseThrow().status(),
            secondTask.getOutcome(0).orElseThrow().status());
    assertThat(statuses)
        .containsExactlyInAnyOrder(FileStatus.PROCESSED, FileStatus.SKIPPED_DUPLICATE);
    assertThat(firstTask.getState()).isEqualTo(TaskState.SUCCEEDED);
    assertThat(secondTask.getState()).isEqualTo(TaskState.SUCCEEDED);
    int storedChunks =
        firstTask.getOutcome(0).orElseThrow().storedChunks()
            + secondTask.getOutcome(0).orElseThrow().storedChunks();
    assertThat(storedChunks).isPositive();
    assertThat(store.count()).isEqualTo(storedChunks);
    assertThat(store.getDocumentChunks(fromFirst.contentHash())).hasSize(storedChunks);
  }

  /** Delays every call so that concurrent tasks overlap. */
  private static final class SlowEmbedder implements Embedder {

    private final Embedder delegate;

    SlowEmbedder(Embedder delegate) {
      this.delegate = delegate;
    }

    @Override
    public String type() {
      return delegate.type();
    }

    @Override
    public int dimension() {
      return delegate.dimension();
    }

    @Override
    public int batchSize() {
      return delegate.batchSize();
    }

    @Override
    public List<float[]> embed(List<String> texts) {
      try {
        Thread.sleep(150);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while embedding", e);
      }
      return delegate.embed(texts);
    }
  }
}

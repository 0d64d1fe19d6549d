package com.flamingo.ai.ragpipeline.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragpipeline.service.hash.ContentHasher;
import com.flamingo.ai.ragpipeline.service.rag.embedding.Embedder;
import com.flamingo.ai.ragpipeline.service.rag.embedding.EmbeddingExecutor;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ChunkMetadataKeys;
import com.flamingo.ai.ragpipeline.service.rag.extraction.ExtractorPipeline;
import com.flamingo.ai.ragpipeline.service.rag.extraction.KeywordExtractor;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ConfiguredParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.DocumentParser;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ParsedChunk;
import com.flamingo.ai.ragpipeline.service.rag.parsing.ParserChain;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedDatabase;
import com.flamingo.ai.ragpipeline.service.rag.resolver.ResolvedPipeline;
import com.flamingo.ai.ragpipeline.service.rag.routing.ContentSniffer;
import com.flamingo.ai.ragpipeline.service.rag.routing.FormatRouter;
import com.flamingo.ai.ragpipeline.service.rag.store.InMemoryStore;
import com.flamingo.ai.ragpipeline.service.rag.store.VectorRecord;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FileIngestionService Tests")
class FileIngestionServiceTest {

  @Mock private DocumentParser textParser;
  @Mock private Embedder embedder;

  @TempDir Path tempDir;

  private final ContentHasher contentHasher = new ContentHasher();

  private InMemoryStore store;
  private ResolvedPipeline pipeline;
  private FileIngestionService service;

  @BeforeEach
  void setUp() throws IOException {
    lenient().when(textParser.type()).thenReturn("TextParser");
    lenient().when(embedder.type()).thenReturn("TestEmbedder");
    lenient().when(embedder.dimension()).thenReturn(3);
    lenient().when(embedder.batchSize()).thenReturn(16);
    lenient()
        .when(embedder.embed(anyList()))
        .thenAnswer(
            invocation -> {
              List<String> texts = invocation.getArgument(0);
              List<float[]> vectors = new ArrayList<>();
              for (String text : texts) {
                vectors.add(
                    text.contains("garbled") ? new float[] {0, 0, 0} : new float[] {1, 0, 0});
              }
              return vectors;
            });

    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    EmbeddingExecutor executor =
        new EmbeddingExecutor(
            "main_database",
            embedder,
            RetryRegistry.ofDefaults(),
            CircuitBreakerRegistry.ofDefaults(),
            meterRegistry);
    store = new InMemoryStore("main_database", 3);
    ResolvedDatabase database =
        new ResolvedDatabase("main_database", executor, store, Map.of(), "semantic");
    ConfiguredParser text =
        new ConfiguredParser(
            "text", textParser, 80, 0, Set.of("txt"), Set.of("text/plain"), List.of());
    pipeline =
        new ResolvedPipeline(
            "universal",
            List.of(text),
            List.of(),
            new ExtractorPipeline(List.of(new KeywordExtractor(3, 1)), null),
            database);
    service =
        new FileIngestionService(
            new FormatRouter(new ContentSniffer()), new ParserChain(), contentHasher);
  }

  private IngestionFile file(String name, byte[] content) throws IOException {
    Path path = tempDir.resolve(name);
    Files.write(path, content);
    return new IngestionFile(
        name, contentHasher.hashBytes(content), path, null, content.length, null);
  }

  private IngestionFile textFile(String name, String content) throws IOException {
    return file(name, content.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("should store every chunk with reserved metadata")
  void shouldStoreChunks() throws IOException {
    IngestionFile notes = textFile("notes.txt", "Kubernetes pods.\n\nKubernetes services.");
    when(textParser.parse(any()))
        .thenReturn(
            List.of(
                new ParsedChunk("Kubernetes pods.", Map.of("line_start", 1)),
                ParsedChunk.of("Kubernetes services.")));

    FileOutcome outcome = service.ingest(notes, pipeline, "docs");

    assertThat(outcome.status()).isEqualTo(FileStatus.PROCESSED);
    assertThat(outcome.parser()).isEqualTo("text");
    assertThat(outcome.storedChunks()).isEqualTo(2);
    List<VectorRecord> stored = store.getDocumentChunks(notes.contentHash());
    assertThat(stored).extracting(VectorRecord::chunkIndex).containsExactly(0, 1);
    assertThat(stored.get(0).id()).isEqualTo(contentHasher.chunkId(notes.contentHash(), 0));
    assertThat(stored.get(0).metadata())
        .containsEntry(ChunkMetadataKeys.FILENAME, "notes.txt")
        .containsEntry(ChunkMetadataKeys.DATASET, "docs")
        .containsEntry(ChunkMetadataKeys.PARSER, "text")
        .containsEntry(ChunkMetadataKeys.TOTAL_CHUNKS, 2)
        .containsEntry(ChunkMetadataKeys.CHUNK_HASH, contentHasher.hashText("Kubernetes pods."))
        .containsEntry("line_start", 1)
        .containsKey("keywords");
  }

  @Test
  @DisplayName("should skip a document that is already stored without parsing it")
  void shouldSkipStoredDocument() throws IOException {
    IngestionFile notes = textFile("notes.txt", "Kubernetes pods.");
    when(textParser.parse(any())).thenReturn(List.of(ParsedChunk.of("Kubernetes pods.")));
    service.ingest(notes, pipeline, "docs");

    IngestionFile copy = textFile("copy-of-notes.txt", "Kubernetes pods.");
    FileOutcome outcome = service.ingest(copy, pipeline, "docs");

    assertThat(outcome.status()).isEqualTo(FileStatus.SKIPPED_DUPLICATE);
    assertThat(store.count()).isEqualTo(1);
    verify(textParser, times(1)).parse(any());
  }

  @Test
  @DisplayName("should report a file no parser accepts as unsupported")
  void shouldReportUnsupported() throws IOException {
    byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 13};
    IngestionFile image = file("photo.png", png);

    FileOutcome outcome = service.ingest(image, pipeline, "docs");

    assertThat(outcome.status()).isEqualTo(FileStatus.SKIPPED_UNSUPPORTED);
    verify(textParser, never()).parse(any());
  }

  @Test
  @DisplayName("should report a parse failure without throwing")
  void shouldReportParseFailure() throws IOException {
    IngestionFile notes = textFile("notes.txt", "Some text");
    when(textParser.parse(any())).thenThrow(new IOException("truncated"));

    FileOutcome outcome = service.ingest(notes, pipeline, "docs");

    assertThat(outcome.status()).isEqualTo(FileStatus.FAILED);
    assertThat(outcome.error()).contains("truncated");
    assertThat(store.containsDocument(notes.contentHash())).isFalse();
  }

  @Test
  @DisplayName("should drop chunks whose embedding failed and store the rest")
  void shouldDropFailedChunks() throws IOException {
    IngestionFile notes = textFile("notes.txt", "Readable.\n\ngarbled");
    when(textParser.parse(any()))
        .thenReturn(List.of(ParsedChunk.of("Readable text."), ParsedChunk.of("garbled")));

    FileOutcome outcome = service.ingest(notes, pipeline, "docs");

    assertThat(outcome.status()).isEqualTo(FileStatus.PROCESSED);
    assertThat(outcome.totalChunks()).isEqualTo(2);
    assertThat(outcome.storedChunks()).isEqualTo(1);
    assertThat(outcome.failedChunks()).isEqualTo(1);
    assertThat(store.getDocumentChunks(notes.contentHash()))
        .extracting(VectorRecord::chunkIndex)
        .containsExactly(0);
  }

  @Test
  @DisplayName("should fail the file when every embedding failed")
  void shouldFailWhenEveryEmbeddingFailed() throws IOException {
    IngestionFile notes = textFile("notes.txt", "garbled");
    when(textParser.parse(any())).thenReturn(List.of(ParsedChunk.of("garbled")));

    FileOutcome outcome = service.ingest(notes, pipeline, "docs");

    assertThat(outcome.status()).isEqualTo(FileStatus.FAILED);
    assertThat(outcome.error()).isEqualTo("Embedding failed for every chunk");
    assertThat(store.count()).isZero();
  }

  @Test
  @DisplayName("should register an empty file as a document without chunks")
  void shouldRegisterEmptyFile() throws IOException {
    IngestionFile empty = textFile("empty.txt", "  \n ");

    FileOutcome outcome = service.ingest(empty, pipeline, "docs");

    assertThat(outcome.status()).isEqualTo(FileStatus.PROCESSED);
    assertThat(outcome.totalChunks()).isZero();
    assertThat(store.containsDocument(empty.contentHash())).isTrue();
    verify(textParser, never()).parse(any());
  }
}

package com.flamingo.ai.ragpipeline.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragpipeline.exception.ParseException;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingSettings;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingStrategy;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ParserChain Tests")
class ParserChainTest {

  @Mock private DocumentParser primary;

  @Mock private DocumentParser fallback;

  @TempDir Path tempDir;

  private final ParserChain parserChain = new ParserChain();

  @BeforeEach
  void setUp() {
    lenient().when(primary.type()).thenReturn("PdfParser");
    lenient().when(fallback.type()).thenReturn("TikaParser");
  }

  private ConfiguredParser configured(String name, DocumentParser parser, int priority) {
    return new ConfiguredParser(name, parser, priority, 0, Set.of(), Set.of(), List.of());
  }

  private List<ConfiguredParser> chain() {
    return List.of(configured("pdf", primary, 100), configured("tika", fallback, 10));
  }

  private ParserInput input(String fileName, byte[] content) throws IOException {
    Path path = tempDir.resolve(fileName);
    Files.write(path, content);
    return new ParserInput(path, fileName, null, content.length);
  }

  @Test
  @DisplayName("should use the primary parser when it succeeds")
  void shouldUsePrimaryParser() throws IOException {
    ParserInput file = input("report.pdf", "%PDF-1.7 content".getBytes(StandardCharsets.UTF_8));
    when(primary.parse(file)).thenReturn(List.of(ParsedChunk.of("page one")));

    ParserChain.Result result = parserChain.parse(file, chain());

    assertThat(result.parserName()).isEqualTo("pdf");
    assertThat(result.chunks()).extracting(ParsedChunk::text).containsExactly("page one");
    verify(fallback, never()).parse(any());
  }

  @Test
  @DisplayName("should fall back to the next parser when the primary throws")
  void shouldFallBackWhenPrimaryThrows() throws IOException {
    ParserInput file = input("broken.pdf", "%PDF-1.7 garbage".getBytes(StandardCharsets.UTF_8));
    when(primary.parse(file)).thenThrow(new IOException("Missing root object"));
    when(fallback.parse(file)).thenReturn(List.of(ParsedChunk.of("recovered text")));

    ParserChain.Result result = parserChain.parse(file, chain());

    assertThat(result.parserName()).isEqualTo("tika");
    assertThat(result.chunks()).extracting(ParsedChunk::text).containsExactly("recovered text");
    assertThat(result.attempts()).hasSize(2);
    assertThat(result.attempts().get(0).succeeded()).isFalse();
    assertThat(result.attempts().get(0).describeFailure()).contains("Missing root object");
  }

  @Test
  @DisplayName("should treat a parser yielding no chunks as a failure")
  void shouldFallBackWhenPrimaryProducesNothing() throws IOException {
    ParserInput file = input("scan.pdf", "%PDF-1.7 image only".getBytes(StandardCharsets.UTF_8));
    when(primary.parse(file)).thenReturn(List.of());
    when(fallback.parse(file)).thenReturn(List.of(ParsedChunk.of("ocr text")));

    ParserChain.Result result = parserChain.parse(file, chain());

    assertThat(result.parserName()).isEqualTo("tika");
  }

  @Test
  @DisplayName("should report every attempted parser when all of them fail")
  void shouldThrowWhenAllParsersFail() throws IOException {
    ParserInput file = input("bad.pdf", "not really a pdf".getBytes(StandardCharsets.UTF_8));
    when(primary.parse(file)).thenThrow(new IllegalStateException("bad xref"));
    when(fallback.parse(file)).thenThrow(new IOException("unreadable"));

    assertThatThrownBy(() -> parserChain.parse(file, chain()))
        .hasMessageContaining("unreadable")
        .isInstanceOfSatisfying(
            ParseException.class,
            e -> assertThat(e.getAttemptedParsers()).containsExactly("pdf", "tika"));
  }

  @Test
  @DisplayName("should return no chunks for a whitespace only file without calling parsers")
  void shouldSkipBlankFile() throws IOException {
    ParserInput file = input("empty.txt", " \n\t\n".getBytes(StandardCharsets.UTF_8));

    ParserChain.Result result = parserChain.parse(file, List.of(configured("pdf", primary, 1)));

    assertThat(result.chunks()).isEmpty();
    assertThat(result.parserName()).isNull();
    verify(primary, never()).parse(any());
  }

  @Test
  @DisplayName("should return no chunks for a large whitespace only file")
  void shouldSkipLargeBlankFile() throws IOException {
    ParserInput file = input("blank.txt", " \n".repeat(2500).getBytes(StandardCharsets.UTF_8));
    TextParser textParser =
        new TextParser(
            new TextChunker(ChunkingSettings.defaults(ChunkingStrategy.PARAGRAPHS)),
            StandardCharsets.UTF_8,
            1024);

    ParserChain.Result result =
        parserChain.parse(
            file, List.of(configured("text", textParser, 80), configured("tika", fallback, 10)));

    assertThat(file.sizeBytes()).isEqualTo(5000);
    assertThat(result.chunks()).isEmpty();
    assertThat(result.attempts()).isEmpty();
    verify(fallback, never()).parse(any());
  }

  @Test
  @DisplayName("should parse a large file whose content starts after leading whitespace")
  void shouldParseLargeFileWithLateContent() throws IOException {
    String content = " \n".repeat(2500) + "Actual text at the end.";
    ParserInput file = input("late.txt", content.getBytes(StandardCharsets.UTF_8));
    when(primary.parse(file)).thenReturn(List.of(ParsedChunk.of("Actual text at the end.")));

    ParserChain.Result result = parserChain.parse(file, List.of(configured("text", primary, 1)));

    assertThat(result.parserName()).isEqualTo("text");
    assertThat(result.chunks()).hasSize(1);
  }

  @Test
  @DisplayName("should fall back from text to a binary capable parser on invalid UTF-8")
  void shouldFallBackFromTextParserOnMalformedInput() throws IOException {
    ParserInput file = input("data.txt", new byte[] {'a', 'b', (byte) 0xC3, (byte) 0x28, 'c'});
    TextParser textParser =
        new TextParser(
            new TextChunker(ChunkingSettings.defaults(ChunkingStrategy.PARAGRAPHS)),
            StandardCharsets.UTF_8,
            1024);
    when(fallback.parse(file)).thenReturn(List.of(ParsedChunk.of("ab(c")));

    ParserChain.Result result =
        parserChain.parse(
            file, List.of(configured("text", textParser, 80), configured("tika", fallback, 10)));

    assertThat(result.parserName()).isEqualTo("tika");
    assertThat(result.attempts().get(0).parserName()).isEqualTo("text");
  }
}

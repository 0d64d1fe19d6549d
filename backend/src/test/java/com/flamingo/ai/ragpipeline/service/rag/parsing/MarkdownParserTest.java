package com.flamingo.ai.ragpipeline.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingSettings;
import com.flamingo.ai.ragpipeline.service.rag.chunking.ChunkingStrategy;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("MarkdownParser Tests")
class MarkdownParserTest {

  @TempDir Path tempDir;

  private final MarkdownParser parser =
      new MarkdownParser(new TextChunker(ChunkingSettings.defaults(ChunkingStrategy.PARAGRAPHS)));

  @Test
  @DisplayName("should chunk each section and record its heading breadcrumb")
  void shouldRecordHeadingBreadcrumb() throws IOException {
    Path path = tempDir.resolve("guide.md");
    Files.writeString(
        path,
        "# Guide\n\nIntro text.\n\n## Setup\n\nRun the installer.\n",
        StandardCharsets.UTF_8);

    List<ParsedChunk> chunks =
        parser.parse(new ParserInput(path, "guide.md", "text/markdown", Files.size(path)));

    assertThat(chunks).hasSize(2);
    assertThat(chunks.get(0).text()).isEqualTo("Guide\n\nIntro text.");
    assertThat(chunks.get(0).metadata())
        .containsEntry("section", "Guide")
        .containsEntry("heading_path", "Guide")
        .containsEntry("heading_level", 1);
    assertThat(chunks.get(1).text()).isEqualTo("Setup\n\nRun the installer.");
    assertThat(chunks.get(1).metadata())
        .containsEntry("section", "Setup")
        .containsEntry("heading_path", "Guide > Setup")
        .containsEntry("heading_level", 2);
  }

  @Test
  @DisplayName("should keep content before the first heading without a section")
  void shouldKeepPreambleWithoutSection() throws IOException {
    Path path = tempDir.resolve("notes.md");
    Files.writeString(
        path, "Loose text first.\n\n- item one\n- item two\n", StandardCharsets.UTF_8);

    List<ParsedChunk> chunks =
        parser.parse(new ParserInput(path, "notes.md", null, Files.size(path)));

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).text()).contains("Loose text first.").contains("- item one");
    assertThat(chunks.get(0).metadata()).doesNotContainKey("section");
  }
}

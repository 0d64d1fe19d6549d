package com.flamingo.ai.ragpipeline.service.rag.parsing;

import com.flamingo.ai.ragpipeline.service.rag.chunking.TextChunker;
import com.flamingo.ai.ragpipeline.service.rag.chunking.TextSpan;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;

/**
 * {@link DocumentParser} for Markdown files.
 *
 * <p>Uses {@code commonmark-java} to walk the Markdown AST. Headings open sections; paragraphs,
 * lists and code blocks become section content. Each section is chunked on its own and every
 * chunk records its heading and the heading breadcrumb above it.
 */
@Slf4j
public class MarkdownParser implements DocumentParser {

  public static final String TYPE = "MarkdownParser";

  private static final Parser PARSER = Parser.builder().build();

  private final TextChunker chunker;

  public MarkdownParser(TextChunker chunker) {
    this.chunker = chunker;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public List<ParsedChunk> parse(ParserInput input) throws IOException {
    Node document;
    try (Reader reader = Files.newBufferedReader(input.path(), StandardCharsets.UTF_8)) {
      document = PARSER.parseReader(reader);
    }

    SectionVisitor visitor = new SectionVisitor();
    document.accept(visitor);

    List<ParsedChunk> chunks = new ArrayList<>();
    for (Section section : visitor.finish()) {
      for (TextSpan span : chunker.chunkSection(section.content(), section.title())) {
        Map<String, Object> metadata = new HashMap<>();
        if (span.section() != null) {
          metadata.put("section", span.section());
        }
        if (!section.breadcrumb().isEmpty()) {
          metadata.put("heading_path", String.join(" > ", section.breadcrumb()));
          metadata.put("heading_level", section.level());
        }
        chunks.add(new ParsedChunk(span.text(), metadata));
      }
    }
    log.debug("MarkdownParser produced {} chunks from {}", chunks.size(), input.fileName());
    return chunks;
  }

  private record Section(String title, int level, List<String> breadcrumb, String content) {}

  private static final class SectionVisitor extends AbstractVisitor {

    private final List<Section> sections = new ArrayList<>();
    private final String[] headingStack = new String[7];
    private final StringBuilder currentContent = new StringBuilder();
    private String currentTitle;
    private int currentLevel;
    private List<String> currentBreadcrumb = List.of();

    @Override
    public void visit(Heading heading) {
      closeSection();
      String title = extractText(heading);
      int level = heading.getLevel();
      headingStack[level] = title;
      for (int i = level + 1; i < headingStack.length; i++) {
        headingStack[i] = null;
      }
      List<String> breadcrumb = new ArrayList<>();
      for (int i = 1; i <= level; i++) {
        if (headingStack[i] != null) {
          breadcrumb.add(headingStack[i]);
        }
      }
      currentTitle = title;
      currentLevel = level;
      currentBreadcrumb = breadcrumb;
      // Keep the heading text in the chunk so it is searchable
      currentContent.append(title).append("\n\n");
    }

    @Override
    public void visit(Paragraph paragraph) {
      String text = extractText(paragraph);
      if (!text.isBlank()) {
        currentContent.append(text).append("\n\n");
      }
    }

    @Override
    public void visit(BulletList list) {
      appendList(list, false);
    }

    @Override
    public void visit(OrderedList list) {
      appendList(list, true);
    }

    @Override
    public void visit(FencedCodeBlock codeBlock) {
      currentContent.append(codeBlock.getLiteral()).append("\n\n");
    }

    @Override
    public void visit(IndentedCodeBlock codeBlock) {
      currentContent.append(codeBlock.getLiteral()).append("\n\n");
    }

    List<Section> finish() {
      closeSection();
      return sections;
    }

    private void closeSection() {
      if (!currentContent.toString().isBlank()) {
        sections.add(
            new Section(currentTitle, currentLevel, currentBreadcrumb, currentContent.toString()));
      }
      currentContent.setLength(0);
    }

    private void appendList(Node list, boolean ordered) {
      Node item = list.getFirstChild();
      int number = 1;
      while (item != null) {
        String text = extractText(item);
        if (!text.isBlank()) {
          currentContent.append(ordered ? (number++) + ". " : "- ").append(text).append('\n');
        }
        item = item.getNext();
      }
      currentContent.append('\n');
    }

    private String extractText(Node node) {
      StringBuilder sb = new StringBuilder();
      collectNodeText(node, sb);
      return sb.toString().trim();
    }

    private void collectNodeText(Node node, StringBuilder sb) {
      if (node instanceof Text textNode) {
        sb.append(textNode.getLiteral());
      } else if (node instanceof Code code) {
        sb.append(code.getLiteral());
      } else if (node instanceof SoftLineBreak) {
        sb.append(' ');
      } else {
        Node child = node.getFirstChild();
        while (child != null) {
          collectNodeText(child, sb);
          child = child.getNext();
        }
      }
    }
  }
}

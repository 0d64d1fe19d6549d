package com.flamingo.ai.ragpipeline.service.rag.chunking;

import com.flamingo.ai.ragpipeline.service.rag.TextAnalyzer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts extracted text into ordered chunks according to {@link ChunkingSettings}.
 *
 * <p>Unit based strategies (paragraphs, sentences, headings, semantic) pack whole units into a
 * chunk until the next unit would exceed the chunk size. Units longer than the chunk size are split
 * into fixed windows. When a chunk is closed, its last {@code chunkOverlap} characters (cut at a
 * word boundary) open the next chunk.
 */
public class TextChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern MARKDOWN_HEADER =
      Pattern.compile("^#{1,6}\\s+(.+)$", Pattern.MULTILINE);

  private final ChunkingSettings settings;

  public TextChunker(ChunkingSettings settings) {
    this.settings = settings;
  }

  public ChunkingSettings getSettings() {
    return settings;
  }

  /**
   * Chunks the text.
   *
   * @param text the text to chunk
   * @return chunks in document order, never containing blank text
   */
  public List<TextSpan> chunk(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return switch (settings.strategy()) {
      case PARAGRAPHS -> withoutSection(pack(split(text, PARAGRAPH_BREAK), "\n\n"));
      case SENTENCES -> withoutSection(pack(sentences(text), " "));
      case HEADINGS -> chunkBySections(text, null);
      case SEMANTIC -> withoutSection(chunkSemantically(text));
      case CHARACTERS -> withoutSection(fixedWindows(text.strip()));
    };
  }

  /**
   * Chunks a section whose heading is already known, as emitted by structure aware parsers.
   *
   * @param text the section body
   * @param section the heading of the section, may be null
   * @return chunks tagged with the section
   */
  public List<TextSpan> chunkSection(String text, String section) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    if (settings.strategy() == ChunkingStrategy.HEADINGS) {
      return chunkBySections(text, section);
    }
    List<TextSpan> spans = new ArrayList<>();
    for (TextSpan span : chunk(text)) {
      spans.add(new TextSpan(span.text(), section));
    }
    return spans;
  }

  private List<TextSpan> chunkBySections(String text, String outerSection) {
    List<TextSpan> spans = new ArrayList<>();
    Matcher matcher = MARKDOWN_HEADER.matcher(text);
    int sectionStart = 0;
    String currentHeading = outerSection;
    while (matcher.find()) {
      addSection(spans, text.substring(sectionStart, matcher.start()), currentHeading);
      currentHeading = matcher.group(1).trim();
      sectionStart = matcher.start();
    }
    addSection(spans, text.substring(sectionStart), currentHeading);
    return spans;
  }

  private void addSection(List<TextSpan> spans, String sectionText, String heading) {
    if (sectionText.isBlank()) {
      return;
    }
    for (String chunk : pack(split(sectionText, PARAGRAPH_BREAK), "\n\n")) {
      spans.add(new TextSpan(chunk, heading));
    }
  }

  private List<String> chunkSemantically(String text) {
    List<String> sentences = sentences(text);
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    Set<String> previousTerms = Set.of();

    for (String sentence : sentences) {
      Set<String> terms = TextAnalyzer.terms(sentence);
      boolean topicShift =
          current.length() > 0
              && TextAnalyzer.jaccard(previousTerms, terms) < settings.semanticThreshold();
      boolean overflow = current.length() + 1 + sentence.length() > settings.chunkSize();

      if (current.length() > 0 && (topicShift || overflow)) {
        chunks.add(current.toString().strip());
        current.setLength(0);
        if (overflow && !topicShift) {
          current.append(overlapTail(chunks.get(chunks.size() - 1)));
        }
      }
      if (sentence.length() > settings.chunkSize()) {
        chunks.addAll(fixedWindows(sentence));
        current.setLength(0);
      } else {
        if (current.length() > 0) {
          current.append(' ');
        }
        current.append(sentence);
      }
      previousTerms = terms;
    }
    if (!current.toString().isBlank()) {
      chunks.add(current.toString().strip());
    }
    return chunks;
  }

  /** Packs units into chunks no longer than the chunk size. */
  List<String> pack(List<String> units, String separator) {
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean hasContent = false;

    for (String rawUnit : units) {
      String unit = rawUnit.strip();
      if (unit.isEmpty()) {
        continue;
      }

      if (unit.length() > settings.chunkSize()) {
        if (hasContent) {
          chunks.add(current.toString().strip());
        }
        List<String> windows = fixedWindows(unit);
        chunks.addAll(windows);
        current = new StringBuilder(overlapTail(windows.get(windows.size() - 1)));
        hasContent = false;
        continue;
      }

      if (current.length() > 0
          && current.length() + separator.length() + unit.length() > settings.chunkSize()) {
        if (hasContent) {
          String closed = current.toString().strip();
          chunks.add(closed);
          current = new StringBuilder(overlapTail(closed));
          hasContent = false;
        }
        if (current.length() + separator.length() + unit.length() > settings.chunkSize()) {
          current.setLength(0);
        }
      }

      if (current.length() > 0) {
        current.append(separator);
      }
      current.append(unit);
      hasContent = true;
    }

    if (hasContent) {
      chunks.add(current.toString().strip());
    }
    return chunks;
  }

  /** Fixed windows of chunk size, each starting {@code size - overlap} after the previous one. */
  List<String> fixedWindows(String text) {
    List<String> windows = new ArrayList<>();
    int step = settings.chunkSize() - settings.chunkOverlap();
    for (int start = 0; start < text.length(); start += step) {
      int end = Math.min(text.length(), start + settings.chunkSize());
      String window = text.substring(start, end).strip();
      if (!window.isEmpty()) {
        windows.add(window);
      }
      if (end == text.length()) {
        break;
      }
    }
    return windows;
  }

  String overlapTail(String text) {
    int overlap = settings.chunkOverlap();
    if (overlap == 0 || text.isEmpty()) {
      return "";
    }
    if (text.length() <= overlap) {
      return text;
    }
    String tail = text.substring(text.length() - overlap);
    // Do not start the next chunk in the middle of a word
    if (!Character.isWhitespace(text.charAt(text.length() - overlap - 1))) {
      int boundary = tail.indexOf(' ');
      if (boundary >= 0) {
        tail = tail.substring(boundary + 1);
      }
    }
    return tail.strip();
  }

  private static List<String> split(String text, Pattern pattern) {
    return List.of(pattern.split(text));
  }

  private static List<String> sentences(String text) {
    List<String> sentences = new ArrayList<>();
    for (String paragraph : PARAGRAPH_BREAK.split(text)) {
      for (String sentence : SENTENCE_BREAK.split(paragraph.strip())) {
        String normalized = sentence.replaceAll("\\s+", " ").strip();
        if (!normalized.isEmpty()) {
          sentences.add(normalized);
        }
      }
    }
    return sentences;
  }

  private static List<TextSpan> withoutSection(List<String> chunks) {
    List<TextSpan> spans = new ArrayList<>(chunks.size());
    for (String chunk : chunks) {
      spans.add(new TextSpan(chunk, null));
    }
    return spans;
  }
}

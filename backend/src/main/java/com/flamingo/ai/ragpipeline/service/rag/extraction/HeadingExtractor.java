package com.flamingo.ai.ragpipeline.service.rag.extraction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects headings found inside a chunk: Markdown, underlined, numbered and ALL-CAPS headings,
 * deduplicated case-insensitively in the order of the patterns.
 */
public class HeadingExtractor implements ChunkExtractor {

  public static final String TYPE = "HeadingExtractor";
  public static final String KEY = "headings";

  private static final Pattern MARKDOWN_HEADER =
      Pattern.compile("^#{1,6}\\s+(.+)$", Pattern.MULTILINE);
  private static final Pattern UNDERLINE_HEADER =
      Pattern.compile("^(.+)\\n[=\\-]{3,}$", Pattern.MULTILINE);
  private static final Pattern NUMBERED_HEADER =
      Pattern.compile("^\\d+\\.\\s+([A-Z].+)$", Pattern.MULTILINE);
  private static final Pattern CAPS_HEADER =
      Pattern.compile("^([A-Z][A-Z\\s]{5,})$", Pattern.MULTILINE);

  private static final List<Pattern> PATTERNS =
      List.of(MARKDOWN_HEADER, UNDERLINE_HEADER, NUMBERED_HEADER, CAPS_HEADER);

  private final int maxHeadings;

  public HeadingExtractor(int maxHeadings) {
    this.maxHeadings = Math.max(1, maxHeadings);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Map<String, Object> extract(ExtractionContext context) {
    List<String> headings = extractHeadings(context.text());
    return headings.isEmpty() ? Map.of() : Map.of(KEY, headings);
  }

  List<String> extractHeadings(String content) {
    if (content == null || content.isEmpty()) {
      return List.of();
    }
    List<String> headings = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(content);
      while (matcher.find() && headings.size() < maxHeadings) {
        String header = matcher.group(1).trim();
        if (header.length() > 3 && seen.add(header.toLowerCase(Locale.ROOT))) {
          headings.add(header);
        }
      }
    }
    return headings;
  }
}

package com.flamingo.ai.ragpipeline.service.rag.extraction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/** Computes size and readability statistics of a chunk. */
public class StatisticsExtractor implements ChunkExtractor {

  public static final String TYPE = "StatisticsExtractor";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(\\s|$)");

  private final int wordsPerMinute;

  public StatisticsExtractor(int wordsPerMinute) {
    this.wordsPerMinute = Math.max(1, wordsPerMinute);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Map<String, Object> extract(ExtractionContext context) {
    String text = context.text().strip();
    String[] words = text.isEmpty() ? new String[0] : WHITESPACE.split(text);
    long letters = 0;
    for (String word : words) {
      letters += word.codePoints().filter(Character::isLetterOrDigit).count();
    }
    long sentences = SENTENCE_END.matcher(text).results().count();
    if (sentences == 0 && words.length > 0) {
      sentences = 1;
    }

    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("word_count", words.length);
    stats.put("char_count", text.length());
    stats.put("sentence_count", sentences);
    stats.put("avg_word_length", words.length == 0 ? 0.0 : round((double) letters / words.length));
    stats.put("reading_time_minutes", round((double) words.length / wordsPerMinute));
    return stats;
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
